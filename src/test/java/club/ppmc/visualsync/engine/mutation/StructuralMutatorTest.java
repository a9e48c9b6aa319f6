package club.ppmc.visualsync.engine.mutation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import club.ppmc.visualsync.engine.parser.ConstructTreeParser;
import club.ppmc.visualsync.exception.SourceFormattingException;
import club.ppmc.visualsync.model.InsertPosition;
import club.ppmc.visualsync.model.NodeBounds;
import club.ppmc.visualsync.model.tree.ConstructNode;
import club.ppmc.visualsync.model.tree.RootNode;
import club.ppmc.visualsync.model.value.OpaqueExpression;
import club.ppmc.visualsync.model.value.StringValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class StructuralMutatorTest {

    private static final String GROUP = "Group(items:[Leaf(text:'A'),Leaf(text:'B')])";

    private static final String COLUMN = String.join("\n",
            "Column(",
            "  children: [",
            "    Text('One'),",
            "  ],",
            ")",
            "");

    private static final String TWO_TEXTS = String.join("\n",
            "Column(",
            "  children: [",
            "    Text('One'),",
            "    Text('Two'),",
            "  ],",
            ")",
            "");

    private final ConstructTreeParser parser = new ConstructTreeParser();
    private final StructuralMutator mutator = new StructuralMutator(parser, SourceFormatter.identity());

    /** 前序遍历中第 index 个名为 name 的节点的范围。 */
    private NodeBounds bounds(String text, String name, int index) {
        var matches = new ArrayList<ConstructNode>();
        collect(parser.parseTree(text, null).getChildren(), name, matches);
        return matches.get(index).toBounds();
    }

    private static void collect(List<ConstructNode> nodes, String name, List<ConstructNode> out) {
        for (ConstructNode node : nodes) {
            if (node.getConstructName().equals(name)) {
                out.add(node);
            }
            collect(node.getChildren(), name, out);
        }
    }

    /** 忽略位置与空白的树结构描述。 */
    private static String shape(List<ConstructNode> nodes) {
        return nodes.stream()
                .map(node -> node.getConstructName() + node.getAttributes() + "{" + shape(node.getChildren()) + "}")
                .collect(Collectors.joining(","));
    }

    @Test
    void updateAttributeRewritesOnlyTheTargetValue() {
        String result = mutator.updateAttribute(GROUP, bounds(GROUP, "Leaf", 0), "text", "Hello");

        assertEquals("Group(items:[Leaf(text: 'Hello'),Leaf(text:'B')])", result);
        assertTrue(result.contains("text: 'Hello'"));
        assertTrue(result.endsWith("Leaf(text:'B')])"));
    }

    @Test
    void deleteInlineNodeRemovesSeparatingComma() {
        String result = mutator.deleteNode(GROUP, bounds(GROUP, "Leaf", 1));

        assertEquals("Group(items:[Leaf(text:'A')])", result);
        RootNode root = parser.parseTree(result, null);
        assertEquals(1, root.getChildren().get(0).getChildren().size());
    }

    @Test
    void wrapInlineNodeUsesWrapperChildSlot() {
        String text = "Group(items:[Leaf(text:'Hello')])";

        String result = mutator.wrapNode(text, bounds(text, "Leaf", 0), "Box", Map.of("pad", "8"));

        assertEquals("Group(items:[Box(pad: 8, child: Leaf(text:'Hello'))])", result);
        ConstructNode box = parser.parseTree(result, null).getChildren().get(0).getChildren().get(0);
        assertEquals("Box", box.getConstructName());
        assertEquals("child", box.getChildren().get(0).getSlotName());
    }

    @Test
    void wrapMultiLineNodeReindentsBody() {
        String result = mutator.wrapNode(COLUMN, bounds(COLUMN, "Column", 0), "Center", Map.of());

        assertEquals(String.join("\n",
                "Center(",
                "  child: Column(",
                "    children: [",
                "      Text('One'),",
                "    ],",
                "  ),",
                ")",
                ""), result);
    }

    @Test
    void wrapWithScaffoldUsesBodySlot() {
        String text = "Text('x')";

        String result = mutator.wrapNode(text, bounds(text, "Text", 0), "Scaffold", null);

        assertEquals("Scaffold(body: Text('x'))", result);
    }

    @Test
    void updateWithCurrentValueKeepsTreeShape() {
        String result = mutator.updateAttribute(GROUP, bounds(GROUP, "Leaf", 0), "text", "A");

        assertEquals(
                shape(parser.parseTree(GROUP, null).getChildren()),
                shape(parser.parseTree(result, null).getChildren()));
    }

    @Test
    void updateWithCurrentInterpolatedValueLeavesSourceUnchanged() {
        String text = "Column(children: [Text(text: 'Hi $name'), Text(text: 'Count ${items.length}')])";
        RootNode root = parser.parseTree(text, null);
        ConstructNode hi = root.getChildren().get(0).getChildren().get(0);
        ConstructNode count = root.getChildren().get(0).getChildren().get(1);

        assertSame(text, mutator.updateAttribute(text, hi.toBounds(), "text", hi.getAttributes().get("text")));
        assertSame(text, mutator.updateAttribute(text, count.toBounds(), "text", count.getAttributes().get("text")));
    }

    @Test
    void textValueForInterpolatedLiteralKeepsInterpolation() {
        String text = "Text(text: 'Hi $name')";

        String result = mutator.updateAttribute(text, bounds(text, "Text", 0), "text", new StringValue("Bye $name"));

        assertEquals("Text(text: 'Bye $name')", result);
        assertEquals(new OpaqueExpression("'Bye $name'"),
                parser.parseTree(result, null).getChildren().get(0).getAttributes().get("text"));
    }

    @Test
    void stringLiteralArgumentStaysLiteral() {
        String text = "Text('x', semanticsLabel: 'old')";

        String result = mutator.updateAttribute(text, bounds(text, "Text", 0), "semanticsLabel", new StringValue("Title.Case"));

        assertEquals("Text('x', semanticsLabel: 'Title.Case')", result);
    }

    @Test
    void codeLikeValueReplacesExpression() {
        String text = "Icon(Icons.add, color: Colors.red)";

        String result = mutator.updateAttribute(text, bounds(text, "Icon", 0), "color", "Colors.blue");

        assertEquals("Icon(Icons.add, color: Colors.blue)", result);
    }

    @Test
    void missingAttributeIsAddedInline() {
        String result = mutator.updateAttribute(GROUP, bounds(GROUP, "Leaf", 0), "color", "red");

        assertEquals("Group(items:[Leaf(color: 'red', text:'A'),Leaf(text:'B')])", result);
    }

    @Test
    void missingAttributeIsAddedOnOwnLineInMultiLineNode() {
        String result = mutator.updateAttribute(
                COLUMN, bounds(COLUMN, "Column", 0), "mainAxisAlignment", "MainAxisAlignment.center");

        assertEquals(String.join("\n",
                "Column(",
                "  mainAxisAlignment: MainAxisAlignment.center,",
                "  children: [",
                "    Text('One'),",
                "  ],",
                ")",
                ""), result);
    }

    @Test
    void singleLineNodeIsExpandedWhenAttributeAdded() {
        String text = "Text('Hi')\n";

        String result = mutator.updateAttribute(text, bounds(text, "Text", 0), "style", "TextStyle()");

        assertEquals("Text(\n  style: TextStyle(),\n  'Hi',\n)\n", result);
    }

    @Test
    void edgeInsetsMapIsSerialized() {
        String text = "Padding(padding: EdgeInsets.zero, child: Text('x'))";
        var insets = new LinkedHashMap<String, Object>();
        insets.put("all", 8);

        String result = mutator.updateAttribute(text, bounds(text, "Padding", 0), "padding", insets);

        assertEquals("Padding(padding: EdgeInsets.all(8), child: Text('x'))", result);
    }

    @Test
    void placeholderValueLeavesSourceUnchanged() {
        String text = "Padding(child: Text('x'))";

        String result = mutator.updateAttribute(
                text, bounds(text, "Padding", 0), "child", OpaqueExpression.construct("Text"));

        assertSame(text, result);
    }

    @Test
    void insertAfterOwnedLineKeepsListFormatting() {
        String result = mutator.insertNode(COLUMN, bounds(COLUMN, "Text", 0), "Text('Two')", InsertPosition.AFTER);

        assertEquals(TWO_TEXTS, result);
    }

    @Test
    void insertBeforeOwnedLine() {
        String result = mutator.insertNode(COLUMN, bounds(COLUMN, "Text", 0), "Text('Zero')", InsertPosition.BEFORE);

        assertEquals(String.join("\n",
                "Column(",
                "  children: [",
                "    Text('Zero'),",
                "    Text('One'),",
                "  ],",
                ")",
                ""), result);
    }

    @Test
    void insertByLineFindsAnchor() {
        assertEquals(TWO_TEXTS, mutator.insertNode(COLUMN, 3, "Text('Two')", InsertPosition.AFTER));
        assertSame(COLUMN, mutator.insertNode(COLUMN, 40, "Text('Two')", InsertPosition.AFTER));
    }

    @Test
    void insertInlineSibling() {
        String result = mutator.insertNode(GROUP, bounds(GROUP, "Leaf", 1), "Leaf(text:'C')", InsertPosition.AFTER);

        assertEquals("Group(items:[Leaf(text:'A'),Leaf(text:'B'), Leaf(text:'C')])", result);
    }

    @Test
    void insertChildAppendsToChildrenList() {
        String result = mutator.insertNode(COLUMN, bounds(COLUMN, "Column", 0), "Text('Two')", InsertPosition.AS_CHILD);

        assertEquals(TWO_TEXTS, result);
        assertEquals(2, parser.parseTree(result, null).getChildren().get(0).getChildren().size());
    }

    @Test
    void insertChildAddsMissingSlot() {
        String result = mutator.insertNode(GROUP, bounds(GROUP, "Group", 0), "Leaf(text:'C')", InsertPosition.AS_CHILD);

        // Group 没有 child/children 槽位，独占一行时展开为多行
        assertEquals("Group(\n  child: Leaf(text:'C'),\n  items:[Leaf(text:'A'),Leaf(text:'B')],\n)", result);
    }

    @Test
    void insertChildIntoInlineChildrenList() {
        String text = "Row(children: [Text('a')])";

        String result = mutator.insertNode(text, bounds(text, "Row", 0), "Text('b')", InsertPosition.AS_CHILD);

        assertEquals("Row(children: [Text('a'), Text('b')])", result);
    }

    @Test
    void insertChildReplacesSingleChild() {
        String text = "Padding(child: Text('a'))";

        String result = mutator.insertNode(text, bounds(text, "Padding", 0), "Text('b')", InsertPosition.AS_CHILD);

        assertEquals("Padding(child: Text('b'))", result);
    }

    @Test
    void insertChildIntoEmptyConstruct() {
        String text = "Center()";

        String result = mutator.insertNode(text, bounds(text, "Center", 0), "Text('x')", InsertPosition.AS_CHILD);

        assertEquals("Center(\n  child: Text('x'),\n)", result);
    }

    @Test
    void deleteOwnedLinesRemovesWholeLines() {
        String result = mutator.deleteNode(TWO_TEXTS, bounds(TWO_TEXTS, "Text", 0));

        assertEquals(String.join("\n",
                "Column(",
                "  children: [",
                "    Text('Two'),",
                "  ],",
                ")",
                ""), result);
    }

    @Test
    void reorderIsIndependentOfArgumentOrder() {
        NodeBounds one = bounds(TWO_TEXTS, "Text", 0);
        NodeBounds two = bounds(TWO_TEXTS, "Text", 1);

        String forward = mutator.reorderNodes(TWO_TEXTS, one, two);
        String backward = mutator.reorderNodes(TWO_TEXTS, two, one);

        assertEquals(forward, backward);
        assertTrue(forward.indexOf("Text('Two')") < forward.indexOf("Text('One')"));
    }

    @Test
    void reorderOfNestedRangesIsNoOp() {
        String result = mutator.reorderNodes(
                TWO_TEXTS, bounds(TWO_TEXTS, "Column", 0), bounds(TWO_TEXTS, "Text", 0));

        assertSame(TWO_TEXTS, result);
    }

    @Test
    void staleBoundsAreNoOp() {
        NodeBounds outside = new NodeBounds("Text", 1, 1, 5, GROUP.length() + 10);
        NodeBounds misaligned = new NodeBounds("Leaf", 1, 1, 0, 10);

        assertSame(GROUP, mutator.deleteNode(GROUP, outside));
        assertSame(GROUP, mutator.updateAttribute(GROUP, misaligned, "text", "x"));
        assertSame(GROUP, mutator.wrapNode(GROUP, bounds(GROUP, "Leaf", 0), " ", Map.of()));
    }

    @Test
    void formatterRunsAfterSuccessfulEdit() {
        var formatting = new StructuralMutator(parser, source -> "// formatted\n" + source);

        String result = formatting.deleteNode(GROUP, bounds(GROUP, "Leaf", 1));

        assertEquals("// formatted\nGroup(items:[Leaf(text:'A')])", result);
    }

    @Test
    void formatterFailureReturnsUnformattedResult() {
        var failing = new StructuralMutator(parser, source -> {
            throw new SourceFormattingException("formatter crashed");
        });

        String result = failing.deleteNode(GROUP, bounds(GROUP, "Leaf", 1));

        assertEquals("Group(items:[Leaf(text:'A')])", result);
    }
}
