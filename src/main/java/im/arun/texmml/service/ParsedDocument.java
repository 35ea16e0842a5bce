package im.arun.texmml.service;

import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.model.DocumentTree;
import im.arun.texmml.model.Expression;
import im.arun.texmml.model.ExpressionView;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * A converted document: the finished tree and the context filled while building it.
 */
@Getter
@AllArgsConstructor
public class ParsedDocument {
    private final String docName;
    private final Expression root;
    private final ConversionContext context;

    public DocumentTree toDocumentTree() {
        DocumentTree tree = new DocumentTree();
        tree.setDocName(docName);
        tree.setLocalization(context.getLocalization());
        tree.setStructure(ExpressionView.of(root));
        tree.setCounters(new LinkedHashMap<>(context.getCounters()));
        tree.setReferences(new LinkedHashMap<>(context.getReferences()));
        tree.setBibliography(new LinkedHashMap<>(context.getBibliography()));
        tree.setContents(new ArrayList<>(context.getSectionContents()));
        tree.setDiagnostics(new ArrayList<>(context.getDiagnostics()));
        return tree;
    }
}
