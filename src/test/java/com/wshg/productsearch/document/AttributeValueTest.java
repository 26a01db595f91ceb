package com.wshg.productsearch.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wshg.productsearch.entity.AttributeDataType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AttributeValueTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonNode json(String s) throws Exception {
        return objectMapper.readTree(s);
    }

    @Test
    void number_isNormalized() throws Exception {
        assertEquals(new AttributeValue(AttributeDataType.NUMBER, "1.2"),
                AttributeValue.resolve(json("\"1.20\""), AttributeDataType.NUMBER));
        assertEquals("100", AttributeValue.resolve(json("100.0"), AttributeDataType.NUMBER).getText());
    }

    @Test
    void boolean_rendersYesNo() throws Exception {
        assertEquals("Yes", AttributeValue.resolve(json("true"), AttributeDataType.BOOLEAN).getText());
        assertEquals("No", AttributeValue.resolve(json("\"no\""), AttributeDataType.BOOLEAN).getText());
    }

    @Test
    void date_acceptsDateTimeAndKeepsDay() throws Exception {
        AttributeValue v = AttributeValue.resolve(json("\"2024-03-01T10:00:00+08:00\""), AttributeDataType.DATE);
        assertEquals(AttributeDataType.DATE, v.getKind());
        assertEquals("2024-03-01", v.getText());
    }

    @Test
    void mismatchedValue_fallsBackToText() throws Exception {
        AttributeValue v = AttributeValue.resolve(json("\"about 2kg\""), AttributeDataType.NUMBER);
        assertEquals(AttributeDataType.TEXT, v.getKind());
        assertEquals("about 2kg", v.getText());
        assertEquals(AttributeDataType.TEXT,
                AttributeValue.resolve(json("\"maybe\""), AttributeDataType.BOOLEAN).getKind());
    }

    @Test
    void arraysJoinAndBlanksAreDropped() throws Exception {
        assertEquals("red, blue", AttributeValue.resolve(json("[\"red\", \" \", \"blue\"]"), AttributeDataType.TEXT).getText());
        assertNull(AttributeValue.resolve(json("\"  \""), AttributeDataType.TEXT));
        assertNull(AttributeValue.resolve(json("null"), AttributeDataType.TEXT));
        assertNull(AttributeValue.resolve(null, AttributeDataType.TEXT));
    }
}
