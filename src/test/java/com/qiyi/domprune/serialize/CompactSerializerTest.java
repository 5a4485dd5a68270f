package com.qiyi.domprune.serialize;

import com.qiyi.domprune.ingest.SnapshotParser;
import com.qiyi.domprune.model.DomTree;
import com.qiyi.domprune.sanitize.AttributeSanitizer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Map;

public class CompactSerializerTest {

    private static String compact(String snapshot) {
        return CompactSerializer.serialize(SnapshotParser.parse(snapshot), new IdentifierMap());
    }

    @Test
    public void serialize_shouldRewriteBracketsAndRemapIds() {
        DomTree tree = AttributeSanitizer.clean(
                SnapshotParser.parse("<div><span backend_node_id=\"1\">Hi</span></div>"), Collections.emptyList());
        IdentifierMap idMap = new IdentifierMap();

        String text = CompactSerializer.serialize(tree, idMap);

        Assertions.assertEquals("(div>(span id=0>Hi))", text);
        Assertions.assertEquals(Map.of("1", 0), idMap.asMap());
    }

    @Test
    public void serialize_shouldKeepHtmlBracketsWhenAsked() {
        DomTree tree = SnapshotParser.parse("<div><span backend_node_id=\"1\">Hi</span></div>");

        String text = CompactSerializer.serialize(tree, new IdentifierMap(),
                SerializeOptions.defaults().withKeepHtmlBrackets(true));

        Assertions.assertEquals("<div><span id=0>Hi</span></div>", text);
    }

    @Test
    public void serialize_shouldOrderMetaByPriorityAndDropDuplicates() {
        String text = compact("<div><button backend_node_id=\"5\" title=\"Submit form\" name=\"submit\" "
                + "type=\"submit\" role=\"button\"/></div>");

        Assertions.assertEquals("(div>(button id=0 button submit submit form ))", text);
    }

    @Test
    public void serialize_shouldFilterUrlsMeaninglessValuesAndLongTokens() {
        String text = compact("<input backend_node_id=\"8\" alt=\"http://cdn/x.png\" value=\"null\" "
                + "aria_label=\"Click abcdefghijklmnopq Here\"/>");

        Assertions.assertEquals("(input id=0 click here )", text);
    }

    @Test
    public void serialize_shouldCapMetaAndTextTokens() {
        SerializeOptions options = new SerializeOptions(5, 3, false);

        Assertions.assertEquals("(p a b c )",
                CompactSerializer.serialize(SnapshotParser.parse("<p title=\"a b c d e f g\"/>"), new IdentifierMap(), options));

        SerializeOptions shortText = new SerializeOptions(5, 2, false);
        Assertions.assertEquals("(div>one two)",
                CompactSerializer.serialize(SnapshotParser.parse("<div><text>one two three four</text></div>"),
                        new IdentifierMap(), shortText));
    }

    @Test
    public void serialize_shouldCapTokensPerAttributeValue() {
        SerializeOptions options = new SerializeOptions(2, 20, false);

        String text = CompactSerializer.serialize(
                SnapshotParser.parse("<a title=\"one two three\" aria_label=\"four five\"/>"), new IdentifierMap(), options);

        Assertions.assertEquals("(a four five one two )", text);
    }

    @Test
    public void serialize_shouldUnescapeEntities() {
        Assertions.assertEquals("(p>Tom & Jerry <3)", compact("<p><text>Tom &amp; Jerry &lt;3</text></p>"));
    }

    @Test
    public void serialize_shouldCloseSelfClosingElements() {
        Assertions.assertEquals("(div>(br ))", compact("<div><br/></div>"));
    }

    @Test
    public void serialize_shouldReuseIdsAcrossCallsAndLeaveTreeUntouched() {
        DomTree tree = SnapshotParser.parse(
                "<ul><li backend_node_id=\"40\" title=\"x\"/><li backend_node_id=\"41\" title=\"y\"/></ul>");
        String before = tree.toMarkup();
        IdentifierMap idMap = new IdentifierMap();
        idMap.idFor("41");

        String first = CompactSerializer.serialize(tree, idMap);
        String second = CompactSerializer.serialize(tree, idMap);

        Assertions.assertEquals("(ul>(li id=1 x )(li id=0 y ))", first);
        Assertions.assertEquals(first, second);
        Assertions.assertEquals(2, idMap.size());
        Assertions.assertEquals(before, tree.toMarkup());
    }

    @Test
    public void serialize_shouldDropAttributesOfTextNodes() {
        Assertions.assertEquals("(b>bold)", compact("<b><text backend_node_id=\"3\" title=\"t\">bold</text></b>"));
    }
}
