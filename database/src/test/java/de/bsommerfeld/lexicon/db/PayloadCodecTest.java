package de.bsommerfeld.lexicon.db;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PayloadCodecTest {

    private final PayloadCodec codec = new PayloadCodec();

    @Test
    void encodeList_null_shouldWriteEmptyArray() {
        assertEquals("[]", codec.encodeList(null));
    }

    @Test
    void decodeNodeList_shouldKeepElementOrderAndShape() {
        List<JsonNode> nodes = codec.decodeNodeList("[\"to eat\",{\"type\":\"text\",\"text\":\"x\"}]", "glossary");

        assertEquals(2, nodes.size());
        assertEquals("to eat", nodes.get(0).asText());
        assertTrue(nodes.get(1).isObject());
        assertEquals("x", nodes.get(1).get("text").asText());
    }

    @Test
    void decodeNodeList_nonArray_shouldThrow() {
        assertThrows(PayloadDecodeException.class, () -> codec.decodeNodeList("{\"a\":1}", "glossary"));
    }

    @Test
    void decodeTree_malformed_shouldThrowWithColumnName() {
        PayloadDecodeException e = assertThrows(PayloadDecodeException.class,
                () -> codec.decodeTree("{not json", "term_meta.data"));
        assertTrue(e.getMessage().contains("term_meta.data"));
    }

    @Test
    void decodeStringMap_shouldKeepKeyOrder() {
        Map<String, String> stats = new LinkedHashMap<>();
        stats.put("strokes", "9");
        stats.put("grade", "2");
        stats.put("freq", "331");

        Map<String, String> decoded = codec.decodeStringMap(codec.encode(stats), "kanji.stats");

        assertEquals(List.of("strokes", "grade", "freq"), List.copyOf(decoded.keySet()));
    }

    @Test
    void decodeStringList_malformed_shouldThrow() {
        assertThrows(PayloadDecodeException.class, () -> codec.decodeStringList("[1,", "kanji.meanings"));
    }
}
