package com.ghosttrace.agent;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValueSerializerTest {

    private final RenderLimits defaults = RenderLimits.defaults();

    static class Item {
        String sku = "A1";
        int qty = 2;
    }

    static class Order {
        String id = "o-1";
        Item item = new Item();
        static String IGNORED = "static";
    }

    static class Node {
        Node next;
    }

    enum Status { OPEN }

    @Test
    void scalarsRenderAsTheirValue() {
        assertEquals("null", ValueSerializer.render(null, defaults));
        assertEquals("42", ValueSerializer.render(42, defaults));
        assertEquals("true", ValueSerializer.render(true, defaults));
        assertEquals("2.5", ValueSerializer.render(2.5, defaults));
        assertEquals("OPEN", ValueSerializer.render(Status.OPEN, defaults));
        assertEquals("\"hi\"", ValueSerializer.render("hi", defaults));
        assertEquals("'c'", ValueSerializer.render('c', defaults));
    }

    @Test
    void collectionsAreTruncated() {
        assertEquals("[1, 2, 3, ...+2]", ValueSerializer.render(List.of(1, 2, 3, 4, 5), defaults));
        assertEquals("[1, 2]", ValueSerializer.render(new int[] {1, 2}, defaults));
        assertEquals("[]", ValueSerializer.render(new ArrayList<>(), defaults));
    }

    @Test
    void mapsRenderKeyValuePairs() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("a", 1);
        map.put("b", 2);
        assertEquals("{\"a\"=1, \"b\"=2}", ValueSerializer.render(map, defaults));

        map.put("c", 3);
        map.put("d", 4);
        assertEquals("{\"a\"=1, \"b\"=2, \"c\"=3, ...+1}", ValueSerializer.render(map, defaults));
    }

    @Test
    void pojosExpandFieldsUpToTheDepthLimit() {
        assertEquals("Order{id=\"o-1\", item=Item{sku=\"A1\", qty=2}}",
            ValueSerializer.render(new Order(), defaults));
        assertEquals("Order{id=\"o-1\", item=<Item>}",
            ValueSerializer.render(new Order(), new RenderLimits(1, 3)));
    }

    @Test
    void nestedContainersStopAtTheDepthLimit() {
        assertEquals("[<ArrayList>]",
            ValueSerializer.render(List.of(new ArrayList<>(List.of(1))), new RenderLimits(1, 3)));
    }

    @Test
    void cyclesAreDetected() {
        Node a = new Node();
        a.next = a;
        assertEquals("Node{next=<circular>}", ValueSerializer.render(a, new RenderLimits(5, 3)));
    }

    @Test
    void invalidLimitsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RenderLimits(0, 3));
        assertThrows(IllegalArgumentException.class, () -> new RenderLimits(2, -1));
    }
}
