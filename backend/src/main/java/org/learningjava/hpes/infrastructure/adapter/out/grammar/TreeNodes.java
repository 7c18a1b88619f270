package org.learningjava.hpes.infrastructure.adapter.out.grammar;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayDeque;
import java.util.Deque;

final class TreeNodes {

    private TreeNodes() {
    }

    // iterative, deeply nested documents must not overflow the stack
    static int count(JsonNode root) {
        int count = 0;
        Deque<JsonNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            JsonNode node = stack.pop();
            count++;
            node.elements().forEachRemaining(stack::push);
        }
        return count;
    }
}
