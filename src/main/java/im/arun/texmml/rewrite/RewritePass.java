package im.arun.texmml.rewrite;

import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.model.Expression;

/**
 * One step of the rewrite pipeline. Passes mutate the tree in place and must leave
 * every node's position bookkeeping consistent.
 */
public interface RewritePass {

    /** Short name used in progress reports and logs. */
    String getName();

    void apply(Expression root, ConversionContext context);
}
