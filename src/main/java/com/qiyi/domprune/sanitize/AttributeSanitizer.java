package com.qiyi.domprune.sanitize;

import com.qiyi.domprune.model.DomNode;
import com.qiyi.domprune.model.DomTree;
import com.qiyi.domprune.util.TextUtil;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 属性清洗与包装节点折叠。
 * 每个节点只保留固定白名单属性与 backend_node_id，图标 svg 只保留含 icon 的 class token，
 * 空 text 伪节点移除，结构上冗余的单子节点包装层被拆掉。
 * 输入树不会被修改，结果是一棵新树。
 */
public class AttributeSanitizer {
    private static final Logger logger = LogManager.getLogger(AttributeSanitizer.class);

    /**
     * 保留在紧凑表示里的显著属性
     */
    public static final Set<String> SALIENT_ATTRIBUTES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "alt", "aria_description", "aria_label", "aria_role",
            "input_checked", "input_value", "label", "name",
            "option_selected", "placeholder", "role", "text_value",
            "title", "type", "value"
    )));

    public static final String ICON_TAG = "svg";
    public static final String CLASS_ATTR = "class";

    // role 取这些值时不携带信息
    private static final Set<String> UNINFORMATIVE_ROLES = new HashSet<>(Arrays.asList(
            "presentation", "none", "link"
    ));
    private static final String HIDDEN_TYPE = "hidden";

    /**
     * 清洗整棵树。
     *
     * @param tree 原始树，不会被修改
     * @param mustKeepIds 不允许被折叠的 backend_node_id（通常是候选集合）
     * @return 清洗后的新树
     */
    public static DomTree clean(DomTree tree, Collection<String> mustKeepIds) {
        Set<String> mustKeep = mustKeepIds == null ? Collections.emptySet() : new HashSet<>(mustKeepIds);
        DomTree copy = tree.copy();
        List<DomNode> worklist = copy.reverseDocumentOrder();
        logger.debug("[SANITIZE] before nodes={}, mustKeep={}", worklist.size(), mustKeep.size());

        int removedText = 0;
        int collapsed = 0;
        // 逆文档顺序：子节点的删除/折叠先于祖先的折叠判定
        for (DomNode node : worklist) {
            reduceAttributes(node);
            if (node.isText()) {
                String value = TextUtil.cleanText(node.getText());
                if (!value.isEmpty()) {
                    node.setText(value);
                } else if (node.getParent() != null) {
                    node.detach();
                    removedText++;
                }
                continue;
            }
            if (isCollapsibleWrapper(node, mustKeep)) {
                node.unwrap();
                collapsed++;
            }
        }

        logger.debug("[SANITIZE] after nodes={}, removedText={}, collapsed={}", copy.size(), removedText, collapsed);
        return copy;
    }

    /**
     * 把单个节点的属性缩减到白名单。
     * 带非空 class 的 svg 按图标处理：只留含 icon 的 class token，其余属性全部去掉；
     * 没有 class 的 svg 与普通节点一样走白名单。
     */
    static void reduceAttributes(DomNode node) {
        Map<String, String> attributes = node.getAttributes();
        boolean icon = isIconGraphic(node);
        for (String key : new ArrayList<>(attributes.keySet())) {
            String raw = attributes.get(key);
            if (DomNode.BACKEND_ID_ATTR.equals(key)) continue;

            if (icon) {
                if (CLASS_ATTR.equals(key) && raw != null && !raw.isEmpty()) {
                    String iconClasses = extractIconClasses(raw);
                    if (!iconClasses.isEmpty()) {
                        attributes.put(key, iconClasses);
                        continue;
                    }
                }
                attributes.remove(key);
                continue;
            }

            if (!SALIENT_ATTRIBUTES.contains(key)) {
                attributes.remove(key);
                continue;
            }

            String value = TextUtil.cleanText(raw);
            if (value.isEmpty()
                    || ("role".equals(key) && UNINFORMATIVE_ROLES.contains(value))
                    || ("type".equals(key) && HIDDEN_TYPE.equals(value))) {
                attributes.remove(key);
            } else {
                attributes.put(key, value);
            }
        }
    }

    static boolean isIconGraphic(DomNode node) {
        if (!ICON_TAG.equals(node.getTag())) return false;
        String classValue = node.getAttribute(CLASS_ATTR);
        return classValue != null && !classValue.isEmpty();
    }

    /**
     * 只保留包含 "icon"（不区分大小写）的 class token。
     */
    static String extractIconClasses(String classValue) {
        List<String> kept = new ArrayList<>();
        for (String token : TextUtil.tokens(classValue)) {
            if (token.toLowerCase(Locale.ROOT).contains("icon")) kept.add(token);
        }
        return String.join(" ", kept);
    }

    /**
     * 包装层判定：不是必须保留的候选、唯一剩下的属性是 backend_node_id、
     * 没有直接的 text 子节点、有父节点、最多一个子节点。
     */
    static boolean isCollapsibleWrapper(DomNode node, Set<String> mustKeep) {
        if (node.isText()) return false;
        String id = node.getBackendId();
        if (id != null && mustKeep.contains(id)) return false;
        Map<String, String> attributes = node.getAttributes();
        if (attributes.size() != 1 || !attributes.containsKey(DomNode.BACKEND_ID_ATTR)) return false;
        if (node.hasTextChild()) return false;
        if (node.getParent() == null) return false;
        return node.childCount() <= 1;
    }
}
