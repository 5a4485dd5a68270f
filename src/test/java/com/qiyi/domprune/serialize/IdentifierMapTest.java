package com.qiyi.domprune.serialize;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;

public class IdentifierMapTest {

    @Test
    public void idFor_shouldAssignDenseIdsInFirstSeenOrder() {
        IdentifierMap idMap = new IdentifierMap();

        Assertions.assertEquals(0, idMap.idFor("900"));
        Assertions.assertEquals(1, idMap.idFor("12"));
        Assertions.assertEquals(0, idMap.idFor("900"));
        Assertions.assertEquals(2, idMap.idFor("7"));

        Assertions.assertEquals(3, idMap.size());
        Assertions.assertEquals("12", idMap.backendIdOf(1));
        Assertions.assertNull(idMap.backendIdOf(3));
        Assertions.assertNull(idMap.backendIdOf(-1));
        Assertions.assertEquals(Map.of(0, "900", 1, "12", 2, "7"), idMap.inverseMap());
        Assertions.assertTrue(idMap.contains("7"));
        Assertions.assertNull(idMap.lookup("8"));
    }

    @Test
    public void idFor_shouldRejectEmptyIdentifier() {
        IdentifierMap idMap = new IdentifierMap();
        Assertions.assertThrows(IllegalArgumentException.class, () -> idMap.idFor(""));
        Assertions.assertThrows(IllegalArgumentException.class, () -> idMap.idFor(null));
    }

    @Test
    public void toJson_shouldExportForwardMapping() {
        IdentifierMap idMap = new IdentifierMap();
        idMap.idFor("a1");
        idMap.idFor("b2");

        JSONObject json = JSON.parseObject(idMap.toJson());

        Assertions.assertEquals(0, json.getIntValue("a1"));
        Assertions.assertEquals(1, json.getIntValue("b2"));
    }
}
