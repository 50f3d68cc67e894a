package com.exprgraph.node;

import com.exprgraph.ast.Val;
import com.exprgraph.graph.InMemoryConnectionStore;
import com.exprgraph.graph.InPinId;
import com.exprgraph.graph.OutPinId;
import com.exprgraph.parse.ParseErrorKind;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class ExpressionNodeTest {

    private InMemoryConnectionStore store;
    private ExpressionNode node;

    @Before
    public void setUp() {
        store = new InMemoryConnectionStore();
        node = new ExpressionNode("expr");
    }

    private static InPinId in(int slot) {
        return new InPinId("expr", slot);
    }

    @Test
    public void testInitialState() {
        assertEquals(Val.ZERO, node.expression());
        assertEquals(0, node.bindingCount());
        assertEquals(0.0, node.currentOutput(), 0.0);
        assertEquals(1, node.inputs());
        assertEquals("0", node.text());
    }

    @Test
    public void testEditUpdatesBindingsAndOutput() {
        EditResult r = node.applyTextEdit("x * y + 1", store);

        assertTrue(r.isApplied());
        assertFalse(r.error().isPresent());
        assertEquals(List.of("x", "y"), node.bindings());
        assertEquals(3, node.inputs());
        assertEquals("x", node.bindingName(1));
        assertEquals("y", node.bindingName(2));
        assertEquals(1.0, node.currentOutput(), 0.0);

        node.setBindingValue(1, 3.0);
        node.setBindingValue(2, 4.0);
        assertEquals(13.0, node.currentOutput(), 0.0);
        assertEquals(4.0, node.bindingValue(2), 0.0);
    }

    @Test
    public void testValuesSurviveReordering() {
        node.applyTextEdit("a - b", store);
        node.setBindingValue(1, 10.0);
        node.setBindingValue(2, 4.0);

        node.applyTextEdit("b - a + c", store);

        assertEquals(List.of("b", "a", "c"), node.bindings());
        assertEquals(4.0, node.bindingValue(1), 0.0);
        assertEquals(10.0, node.bindingValue(2), 0.0);
        assertEquals(0.0, node.bindingValue(3), 0.0);
        assertEquals(-6.0, node.currentOutput(), 0.0);
    }

    @Test
    public void testMalformedEditLeavesStateAndWiresUnchanged() {
        node.applyTextEdit("a + b", store);
        node.setBindingValue(1, 2.0);
        node.setBindingValue(2, 3.0);
        OutPinId remote = new OutPinId("src", 0);
        store.connect(remote, in(1));

        for (String[] c : new String[][] { { "2+", "UNEXPECTED_TOKEN" }, { "(1+2", "UNCLOSED_PAREN" },
                { "1 2", "TRAILING_INPUT" }, { "", "EMPTY_INPUT" } }) {
            EditResult r = node.applyTextEdit(c[0], store);
            assertFalse(c[0], r.isApplied());
            assertEquals(c[0], ParseErrorKind.valueOf(c[1]), r.error().orElseThrow());
            assertEquals(0, r.commands());
            assertEquals(c[0], node.text());
            assertEquals(List.of("a", "b"), node.bindings());
            assertEquals(5.0, node.currentOutput(), 0.0);
            assertEquals(List.of(remote), store.remotes(in(1)));
        }
    }

    @Test
    public void testSpecMigrationExample() {
        node.applyTextEdit("a + b", store);
        OutPinId remoteA = new OutPinId("srcA", 0);
        OutPinId remoteB = new OutPinId("srcB", 0);
        store.connect(remoteA, in(1));
        store.connect(remoteB, in(2));

        EditResult r = node.applyTextEdit("b + c", store);

        assertTrue(r.isApplied());
        assertEquals(List.of("b", "c"), node.bindings());
        assertEquals(List.of(remoteB), store.remotes(in(1)));
        assertTrue(store.remotes(in(2)).isEmpty());
        assertTrue(store.targets(remoteA).isEmpty());
    }

    @Test
    public void testSameTextTwiceIsIdempotent() {
        OutPinId remote = new OutPinId("src", 0);
        node.applyTextEdit("q / p", store);
        store.connect(remote, in(2));
        node.setBindingValue(1, 8.0);

        node.applyTextEdit("p * q", store);
        List<String> bindings = node.bindings();
        double v1 = node.bindingValue(1), v2 = node.bindingValue(2);
        var wires = store.connections();

        EditResult again = node.applyTextEdit("p * q", store);

        assertEquals(0, again.commands());
        assertEquals(bindings, node.bindings());
        assertEquals(v1, node.bindingValue(1), 0.0);
        assertEquals(v2, node.bindingValue(2), 0.0);
        assertEquals(wires, store.connections());
        assertEquals(List.of(remote), store.remotes(in(1)));
    }

    @Test
    public void testSharedVariableReadsOneSlot() {
        node.applyTextEdit("a * a + a", store);
        assertEquals(1, node.bindingCount());
        node.setBindingValue(1, 3.0);
        assertEquals(12.0, node.currentOutput(), 0.0);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testSlotZeroIsNotABinding() {
        node.applyTextEdit("a", store);
        node.bindingValue(0);
    }

    @Test
    public void testSnapshot() {
        node.applyTextEdit("k + 1", store);
        node.setBindingValue(1, 2.5);
        node.applyTextEdit("k +", store);

        NodeState state = node.snapshot();
        assertEquals("k +", state.text());
        assertEquals("k + 1", state.compiledText());
        assertEquals(List.of("k"), state.bindings());
        assertEquals(List.of(2.5), state.values());
    }

    @Test
    public void testRestoreKeepsMatchingLayout() {
        OutPinId remote = new OutPinId("src", 0);
        store.connect(remote, in(2));

        ExpressionNode restored = ExpressionNode.restore("expr",
                new NodeState("m * n", List.of("m", "n"), List.of(2.0, 5.0)), store);

        assertEquals(List.of("m", "n"), restored.bindings());
        assertEquals(10.0, restored.currentOutput(), 0.0);
        assertEquals(List.of(remote), store.remotes(in(2)));
    }

    @Test
    public void testRestoreRevalidatesStaleBindings() {
        // Stored layout lists n before m, but the text yields m first.
        OutPinId remoteN = new OutPinId("srcN", 0);
        OutPinId remoteGone = new OutPinId("srcGone", 0);
        store.connect(remoteN, in(1));
        store.connect(remoteGone, in(3));

        ExpressionNode restored = ExpressionNode.restore("expr",
                new NodeState("m - n", List.of("n", "m", "gone"), List.of(1.0, 4.0, 9.0)), store);

        assertEquals(List.of("m", "n"), restored.bindings());
        assertEquals(3.0, restored.currentOutput(), 0.0);
        assertEquals(List.of(remoteN), store.remotes(in(2)));
        assertTrue(store.remotes(in(1)).isEmpty());
        assertTrue(store.remotes(in(3)).isEmpty());
    }

    @Test
    public void testRestoreMidEditKeepsCompiledStateAndWires() {
        OutPinId remoteA = new OutPinId("srcA", 0);
        OutPinId remoteB = new OutPinId("srcB", 0);
        store.connect(remoteA, in(1));
        store.connect(remoteB, in(2));

        ExpressionNode restored = ExpressionNode.restore("expr",
                new NodeState("a + b +", "a + b", List.of("a", "b"), List.of(2.0, 3.0)), store);

        assertEquals("a + b +", restored.text());
        assertEquals("a + b", restored.compiledText());
        assertEquals(List.of("a", "b"), restored.bindings());
        assertEquals(5.0, restored.currentOutput(), 0.0);
        assertEquals(List.of(remoteA), store.remotes(in(1)));
        assertEquals(List.of(remoteB), store.remotes(in(2)));
    }

    @Test
    public void testRestoreFallsBackToBufferThenZero() {
        store.connect(new OutPinId("src", 0), in(1));

        ExpressionNode fromBuffer = ExpressionNode.restore("expr",
                new NodeState("a * 2", "a +", List.of("a"), List.of(4.0)), store);
        assertEquals(8.0, fromBuffer.currentOutput(), 0.0);
        assertEquals(1, store.size());

        ExpressionNode zero = ExpressionNode.restore("expr",
                new NodeState("a -", "a +", List.of("a"), List.of(4.0)), store);
        assertEquals("a -", zero.text());
        assertEquals(Val.ZERO, zero.expression());
        assertEquals(0, zero.bindingCount());
        assertEquals(0, store.size());
    }

    @Test
    public void testLongSumWithinLimitEvaluates() {
        StringBuilder text = new StringBuilder("a");
        for (int i = 0; i < 2000; i++)
            text.append("+1");
        assertTrue(node.applyTextEdit(text.toString(), store).isApplied());
        node.setBindingValue(1, 0.5);
        assertEquals(2000.5, node.currentOutput(), 0.0);
    }

    @Test
    public void testOverlongTextIsRejected() {
        node.applyTextEdit("a * b", store);
        StringBuilder text = new StringBuilder("a");
        for (int i = 0; i < 10000; i++)
            text.append("+1");

        EditResult result = node.applyTextEdit(text.toString(), store);

        assertEquals(ParseErrorKind.UNEXPECTED_TOKEN, result.error().orElseThrow());
        assertEquals(List.of("a", "b"), node.bindings());
    }

    @Test
    public void testDeeplyNestedTextIsRejected() {
        String text = "(".repeat(1000) + "a" + ")".repeat(1000);

        EditResult result = node.applyTextEdit(text, store);

        assertEquals(ParseErrorKind.UNEXPECTED_TOKEN, result.error().orElseThrow());
        assertEquals(Val.ZERO, node.expression());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNodeStateRejectsNullValue() {
        new NodeState("a", List.of("a"), Arrays.asList((Double) null));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNodeStateRejectsDuplicateBindings() {
        new NodeState("a + a", List.of("a", "a"), List.of(1.0, 2.0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNodeStateRejectsMismatchedLengths() {
        new NodeState("a", List.of("a"), List.of());
    }
}
