package im.arun.texmml.outline;

import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.model.Expression;
import im.arun.texmml.model.SectionEntry;
import im.arun.texmml.tree.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills the context's table of contents: one entry per {@code \section} or
 * {@code \section*}, each listing the subsection titles that follow it.
 */
public class SectionOutlineCollector {
    private static final Logger logger = LoggerFactory.getLogger(SectionOutlineCollector.class);

    public void collect(Expression root, ConversionContext context) {
        SectionEntry[] current = {null};
        TreeUtils.walk(root, node -> {
            if (node.isCommand("section") || node.isCommand("section*")) {
                current[0] = new SectionEntry(TreeUtils.argumentText(node, 0), node.isCommand("section"));
                context.addSection(current[0]);
            } else if (node.isCommand("subsection") || node.isCommand("subsection*")) {
                if (current[0] == null) {
                    logger.debug("Subsection at line {} has no enclosing section", node.getLine());
                    return;
                }
                String title = TreeUtils.argumentText(node, 0);
                if (node.isCommand("subsection")) {
                    current[0].getNumberedSubsections().add(title);
                } else {
                    current[0].getUnnumberedSubsections().add(title);
                }
            }
        });
        logger.debug("Collected {} section(s)", context.getSectionContents().size());
    }
}
