package im.arun.texmml.rewrite;

import im.arun.texmml.catalog.ConstructCatalog;
import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.model.Expression;
import im.arun.texmml.model.ExpressionType;
import im.arun.texmml.tree.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves {@code \author}, {@code \title} and {@code \date} commands written after
 * {@code \begin{document}} to just before it, keeping their relative order.
 */
public class MetadataHoister implements RewritePass {
    private static final Logger logger = LoggerFactory.getLogger(MetadataHoister.class);

    @Override
    public String getName() {
        return "MoveCommandsOutOfDocument";
    }

    @Override
    public void apply(Expression root, ConversionContext context) {
        List<Expression> top = root.group(0);
        int beginDocument = -1;
        for (int i = 0; i < top.size(); i++) {
            Expression node = top.get(i);
            if (node.isCommand("begin") && "document".equals(TreeUtils.argumentText(node, 0))) {
                beginDocument = i;
                break;
            }
        }
        if (beginDocument < 0) {
            return;
        }

        List<Expression> metadata = new ArrayList<>();
        for (int i = beginDocument + 1; i < top.size(); i++) {
            Expression node = top.get(i);
            if (node.is(ExpressionType.COMMAND) && ConstructCatalog.METADATA_COMMANDS.contains(node.getName())) {
                metadata.add(node);
            }
        }
        if (metadata.isEmpty()) {
            return;
        }

        for (Expression node : metadata) {
            node.removeFromParent();
        }
        root.insertChildren(0, beginDocument, metadata);
        logger.debug("Moved {} metadata command(s) before the document body", metadata.size());
    }
}
