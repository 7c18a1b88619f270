package org.learningjava.hpes.infrastructure.adapter.out.grammar;

import org.learningjava.hpes.application.port.GrammarParserPort;
import org.learningjava.hpes.domain.model.parse.ParseBudget;
import org.learningjava.hpes.domain.model.parse.ParseReport;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSPoint;
import org.treesitter.TSTree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Common plumbing for tree-sitter grammars. Tree-sitter always recovers into a
 * tree, so a region is clean only when no ERROR or MISSING node was produced.
 */
public abstract class TreeSitterGrammarAdapter implements GrammarParserPort {

    private static final int CHECKPOINT_EVERY = 1024;

    @Override
    public ParseReport parse(String source, ParseBudget budget) {
        budget.checkpoint();
        // TSParser is not thread safe, one per call
        TSParser parser = new TSParser();
        if (!parser.setLanguage(language())) {
            throw new IllegalStateException("tree-sitter rejected the " + grammarId() + " grammar");
        }
        TSTree tree = parser.parseString(null, source);
        budget.checkpoint();
        if (tree == null) {
            return ParseReport.failed(grammarId(), "no tree produced");
        }

        TSNode root = tree.getRootNode();
        if (root.isNull()) {
            return ParseReport.failed(grammarId(), "no tree produced");
        }
        if (root.hasError()) {
            return ParseReport.failed(grammarId(), 1, List.of(describeFirstError(root)));
        }
        return ParseReport.clean(grammarId(), countNodes(root, budget));
    }

    protected abstract TSLanguage language();

    // descend along the erroneous children to the innermost node carrying the error
    private static String describeFirstError(TSNode root) {
        TSNode node = root;
        boolean descended = true;
        while (descended && !"ERROR".equals(node.getType())) {
            descended = false;
            for (int i = 0; i < node.getChildCount(); i++) {
                TSNode child = node.getChild(i);
                if (!child.isNull() && child.hasError()) {
                    node = child;
                    descended = true;
                    break;
                }
            }
        }
        TSPoint at = node.getStartPoint();
        String what = "ERROR".equals(node.getType()) ? "unexpected input" : "missing " + node.getType();
        return "line " + (at.getRow() + 1) + ":" + at.getColumn() + " " + what;
    }

    private static int countNodes(TSNode root, ParseBudget budget) {
        int count = 0;
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (++count % CHECKPOINT_EVERY == 0) {
                budget.checkpoint();
            }
            for (int i = 0; i < node.getChildCount(); i++) {
                stack.push(node.getChild(i));
            }
        }
        return count;
    }
}
