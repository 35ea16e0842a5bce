package im.arun.texmml.rewrite;

import im.arun.texmml.catalog.ConstructCatalog;
import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.model.Expression;
import im.arun.texmml.model.ExpressionType;
import im.arun.texmml.tree.TreeUtils;

/**
 * Numbers named blocks in document order, one counter per block name, and stores the
 * number in the block's tag. The {@code document} counter is reset afterwards so
 * that labels outside any numbered block start from 1.
 */
public class BlockNumberer implements RewritePass {

    @Override
    public String getName() {
        return "NumberBlocks";
    }

    @Override
    public void apply(Expression root, ConversionContext context) {
        TreeUtils.walk(root, node -> {
            if (node.is(ExpressionType.BLOCK) && !ConstructCatalog.isAnonymousBlock(node.getName())) {
                node.setTag(context.nextCounter(node.getName()));
            }
        });
        context.resetCounter("document");
    }
}
