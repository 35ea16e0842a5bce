package im.arun.texmml.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Tag of a script container: the order of its scripts and whether {@code \limits} was given.
 */
@Data
@AllArgsConstructor
public class ScriptTag {
    private ScriptOrder order;
    private boolean limits;
}
