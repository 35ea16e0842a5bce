package im.arun.texmml.rewrite;

import im.arun.texmml.catalog.ConstructCatalog;
import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.model.Diagnostic;
import im.arun.texmml.model.Expression;
import im.arun.texmml.model.ExpressionType;
import im.arun.texmml.model.LabeledReference;
import im.arun.texmml.tree.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Registers every {@code \label} against the nearest numbered block around it and
 * tags references with the key they point to.
 *
 * <p>A label outside any numbered block (or directly in the document) takes the next
 * value of the {@code document} counter. The first definition of a key wins.
 */
public class LabelResolver implements RewritePass {
    private static final Logger logger = LoggerFactory.getLogger(LabelResolver.class);

    @Override
    public String getName() {
        return "ResolveLabels";
    }

    @Override
    public void apply(Expression root, ConversionContext context) {
        for (Expression label : TreeUtils.collect(root, node -> node.isCommand("label"))) {
            String key = TreeUtils.argumentText(label, 0);
            if (key.isEmpty()) {
                context.report(Diagnostic.Kind.ARGUMENT_SHAPE, "label", "empty label key", label.getLine());
                continue;
            }
            label.setTag(key);
            LabeledReference reference = referenceFor(label, context);
            if (!context.addReference(key, reference)) {
                logger.warn("Label '{}' at line {} is already defined, keeping the first one", key, label.getLine());
                context.report(Diagnostic.Kind.DUPLICATE_LABEL, key, "label defined more than once", label.getLine());
            }
        }

        for (Expression reference : TreeUtils.collect(root, LabelResolver::isReference)) {
            String key = referenceKey(reference);
            reference.setTag(key);
            if (context.resolveReference(key).isEmpty()) {
                logger.warn("Reference to undefined label '{}' at line {}", key, reference.getLine());
                context.report(Diagnostic.Kind.UNDEFINED_REFERENCE, key, "no \\label with this key",
                        reference.getLine());
            }
        }
    }

    private static LabeledReference referenceFor(Expression label, ConversionContext context) {
        Optional<Expression> target = TreeUtils.findAncestor(label, node ->
                node.is(ExpressionType.BLOCK) && !ConstructCatalog.isAnonymousBlock(node.getName()));
        if (target.isEmpty() || target.get().isBlock("document")) {
            return new LabeledReference("document", context.nextCounter("document"));
        }
        Expression block = target.get();
        int number = block.tagAs(Integer.class).orElseGet(() -> context.getCounter(block.getName()));
        return new LabeledReference(block.getName(), number);
    }

    private static boolean isReference(Expression node) {
        return node.is(ExpressionType.COMMAND) && ConstructCatalog.REFERENCE_COMMANDS.contains(node.getName());
    }

    // \hyperref[key]{text} carries the key as its option
    private static String referenceKey(Expression reference) {
        if (reference.isCommand("hyperref") && !reference.getRawOptions().isEmpty()) {
            return reference.getRawOptions().get(0).trim();
        }
        return TreeUtils.argumentText(reference, 0);
    }
}
