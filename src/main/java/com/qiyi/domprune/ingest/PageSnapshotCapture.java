package com.qiyi.domprune.ingest;

import com.microsoft.playwright.Page;
import com.qiyi.domprune.error.StructuralInvariantException;
import com.qiyi.domprune.model.DomTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * 从 Playwright 页面读取快照并解析。
 * backend_node_id 的标注由外部 DOM 抽取脚本完成，这里只负责读取与解析；
 * Playwright 抛出的异常原样向上传播，不做重试。
 */
public class PageSnapshotCapture {
    private static final Logger logger = LogManager.getLogger(PageSnapshotCapture.class);

    private final Page page;

    public PageSnapshotCapture(Page page) {
        if (page == null) throw new IllegalArgumentException("page must not be null");
        this.page = page;
    }

    /**
     * 读取页面当前标记（page.content()）并解析。
     */
    public DomTree capture() {
        String markup = page.content();
        logger.debug("[INGEST] captured page content | url={}, chars={}", safeUrl(), markup == null ? 0 : markup.length());
        return SnapshotParser.parse(markup);
    }

    /**
     * 在页面中执行抽取脚本，脚本须返回已标注 backend_node_id 的快照字符串。
     */
    public DomTree captureWith(String extractionScript) {
        if (extractionScript == null || extractionScript.trim().isEmpty()) {
            throw new IllegalArgumentException("extractionScript must not be empty");
        }
        Object result = page.evaluate(extractionScript);
        if (!(result instanceof String)) {
            throw new StructuralInvariantException("Extraction script did not return a snapshot string | got="
                    + (result == null ? "null" : result.getClass().getSimpleName()));
        }
        String markup = (String) result;
        logger.debug("[INGEST] extracted snapshot | url={}, chars={}", safeUrl(), markup.length());
        return SnapshotParser.parse(markup);
    }

    private String safeUrl() {
        String url = page.url();
        return url == null ? "" : url;
    }
}
