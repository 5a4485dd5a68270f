package com.qiyi.domprune.ingest;

import com.microsoft.playwright.Page;
import com.qiyi.domprune.error.StructuralInvariantException;
import com.qiyi.domprune.model.DomTree;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

public class PageSnapshotCaptureTest {

    @Test
    public void capture_shouldParsePageContent() {
        Page page = Mockito.mock(Page.class);
        Mockito.when(page.url()).thenReturn("https://example.com");
        Mockito.when(page.content()).thenReturn("<html backend_node_id=\"1\"><body backend_node_id=\"2\"/></html>");

        DomTree tree = new PageSnapshotCapture(page).capture();

        Assertions.assertEquals("html", tree.getRoot().getTag());
        Assertions.assertNotNull(tree.findByBackendId("2"));
        Mockito.verify(page).content();
    }

    @Test
    public void captureWith_shouldParseScriptResult() {
        Page page = Mockito.mock(Page.class);
        Mockito.when(page.evaluate(Mockito.anyString())).thenReturn("<div backend_node_id=\"5\"><text>hi</text></div>");

        DomTree tree = new PageSnapshotCapture(page).captureWith("() => window.__snapshot()");

        Assertions.assertEquals("5", tree.getRoot().getBackendId());
        Assertions.assertEquals("hi", tree.getRoot().getChildren().get(0).getText());
    }

    @Test
    public void captureWith_shouldRejectNonStringResult() {
        Page page = Mockito.mock(Page.class);
        Mockito.when(page.evaluate(Mockito.anyString())).thenReturn(42);

        PageSnapshotCapture capture = new PageSnapshotCapture(page);
        Assertions.assertThrows(StructuralInvariantException.class, () -> capture.captureWith("() => 42"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> capture.captureWith(" "));
    }
}
