package im.arun.texmml.service;

/**
 * Receives one notification per pipeline step. Purely observational.
 */
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = (step, total, name) -> { };

    void onStep(int step, int total, String name);
}
