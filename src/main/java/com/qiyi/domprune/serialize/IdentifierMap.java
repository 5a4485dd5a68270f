package com.qiyi.domprune.serialize;

import com.alibaba.fastjson2.JSON;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * backend_node_id 到小整数的双射，按首次出现的顺序递增分配。
 * 同一决策步骤内的多次序列化共享同一个实例：同一元素总是得到同一个整数，
 * 值域恰好是 {0..N-1}。步骤结束后由调用方丢弃。
 */
public class IdentifierMap {

    private final Map<String, Integer> forward = new LinkedHashMap<>();
    private final List<String> inverse = new ArrayList<>();

    /**
     * 返回已分配的整数；未见过的标识分配为当前大小。
     */
    public int idFor(String backendId) {
        if (backendId == null || backendId.isEmpty()) {
            throw new IllegalArgumentException("backendId must not be empty");
        }
        Integer existing = forward.get(backendId);
        if (existing != null) return existing;
        int assigned = inverse.size();
        forward.put(backendId, assigned);
        inverse.add(backendId);
        return assigned;
    }

    public Integer lookup(String backendId) {
        return forward.get(backendId);
    }

    public boolean contains(String backendId) {
        return forward.containsKey(backendId);
    }

    /**
     * 反查；越界返回 null。
     */
    public String backendIdOf(int id) {
        if (id < 0 || id >= inverse.size()) return null;
        return inverse.get(id);
    }

    public int size() {
        return inverse.size();
    }

    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(forward);
    }

    public Map<Integer, String> inverseMap() {
        Map<Integer, String> out = new LinkedHashMap<>();
        for (int i = 0; i < inverse.size(); i++) {
            out.put(i, inverse.get(i));
        }
        return out;
    }

    public String toJson() {
        return JSON.toJSONString(forward);
    }

    @Override
    public String toString() {
        return forward.toString();
    }
}
