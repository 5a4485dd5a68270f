package com.qiyi.domprune.locate;

import com.qiyi.domprune.Fixtures;
import com.qiyi.domprune.ingest.SnapshotParser;
import com.qiyi.domprune.locate.ElementAttributeLocator.ElementAttributes;
import com.qiyi.domprune.locate.ElementAttributeLocator.LocateResult;
import com.qiyi.domprune.model.DomTree;
import com.qiyi.domprune.prune.CandidatePruner;
import com.qiyi.domprune.sanitize.AttributeSanitizer;
import com.qiyi.domprune.serialize.SerializeOptions;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

public class ElementAttributeLocatorTest {

    @Test
    public void locate_shouldListAddressableElementsOfPrunedTree() {
        List<String> candidates = List.of("21", "22");
        DomTree sanitized = AttributeSanitizer.clean(SnapshotParser.parse(Fixtures.SEARCH_PAGE), candidates);
        DomTree pruned = CandidatePruner.prune(sanitized, candidates).getTree();

        LocateResult result = ElementAttributeLocator.locate(pruned, SerializeOptions.defaults());

        Assertions.assertEquals(2, result.elements.size());
        ElementAttributes input = result.elements.get(0);
        Assertions.assertEquals("input", input.tag);
        Assertions.assertEquals("Search the site", input.attributes.get("placeholder"));
        Assertions.assertNull(input.text);

        ElementAttributes button = result.elements.get(1);
        Assertions.assertEquals("button", button.tag);
        Assertions.assertEquals("Go", button.text);

        Assertions.assertEquals(Map.of(0, "21", 1, "22"), result.idToBackendId);
        Assertions.assertTrue(result.treeRepr.contains("(button id=1 submit>Go)"));
    }

    @Test
    public void locate_shouldReportTextNodesWithIdentifiers() {
        DomTree tree = SnapshotParser.parse("<p backend_node_id=\"1\"><text backend_node_id=\"2\">hello</text></p>");

        LocateResult result = ElementAttributeLocator.locate(tree, SerializeOptions.defaults());

        Assertions.assertEquals(2, result.elements.size());
        Assertions.assertEquals("hello", result.elements.get(0).text);
        Assertions.assertEquals("text", result.elements.get(1).tag);
        Assertions.assertEquals("hello", result.elements.get(1).text);
        // 序列化时 text 节点的标识不会进入映射
        Assertions.assertEquals(Map.of(0, "1"), result.idToBackendId);
    }
}
