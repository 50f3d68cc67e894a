package com.exprgraph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.exprgraph.graph.EditListener;
import com.exprgraph.graph.NodeGraph;
import com.exprgraph.io.GraphDocumentMapper;
import com.exprgraph.node.EditResult;
import com.exprgraph.node.ExpressionNode;
import com.exprgraph.util.NodeExplain;

/**
 * Demonstrates an expression node fed by number sources, edited while wired.
 */
public class ExpressionGraphDemo {
    private static final Logger log = LogManager.getLogger(ExpressionGraphDemo.class);

    public static void main(String[] args) {
        log.info("Starting Expression Graph Demo...");

        var graph = new NodeGraph("demo");
        graph.addListener(new EditListener() {
            @Override
            public void onEditApplied(String node, String text, EditResult result) {
                log.info("[{}] '{}' applied ({} store commands)", node, text, result.commands());
            }

            @Override
            public void onEditRejected(String node, String text, EditResult result) {
                log.info("[{}] '{}' rejected: {}", node, text, result.error().orElseThrow());
            }
        });

        graph.addNumber("price", 101.25);
        graph.addNumber("qty", 40);
        graph.addNumber("fee", 2.5);
        ExpressionNode notional = graph.addExpression("notional", "price * qty");
        graph.connectBinding("price", "notional", "price");
        graph.connectBinding("qty", "notional", "qty");
        log.info("notional = {}", graph.evaluate("notional"));

        // Each keystroke is an edit; incomplete text keeps the last valid form.
        for (String keystrokes : new String[] { "price * qty -", "price * qty - (", "price * qty - (fee",
                "price * qty - (fee)" }) {
            graph.editText("notional", keystrokes);
            log.info("notional = {} with bindings {}", graph.evaluate("notional"), notional.bindings());
        }
        graph.connectBinding("fee", "notional", "fee");
        log.info("notional = {}", graph.evaluate("notional"));

        // Reorder: fee takes slot 1, qty slot 2, price slot 3. Wires follow their names.
        graph.editText("notional", "-fee + qty * price");
        log.info("\n{}", new NodeExplain(graph).explainNode("notional"));
        log.info("notional = {}", graph.evaluate("notional"));

        log.info("Saved document:\n{}", new GraphDocumentMapper().write(graph));
    }
}
