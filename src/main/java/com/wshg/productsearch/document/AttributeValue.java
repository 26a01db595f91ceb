package com.wshg.productsearch.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.wshg.productsearch.entity.AttributeDataType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 带类型标记的属性值：kind 为解析后的实际类型，text 为写入向量文本时的规范化字符串。
 * 声明类型与原始值不匹配时（例如 NUMBER 属性填了 "约 2kg"）退化为 TEXT，不报错。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AttributeValue {

    private AttributeDataType kind;
    private String text;

    public static AttributeValue text(String text) {
        return new AttributeValue(AttributeDataType.TEXT, text);
    }

    /**
     * 按属性定义的数据类型解析原始 JSON 值；null / 空值返回 null。
     */
    public static AttributeValue resolve(JsonNode raw, AttributeDataType declared) {
        String plain = plainText(raw);
        if (plain == null || plain.isBlank()) return null;
        AttributeDataType type = declared != null ? declared : AttributeDataType.TEXT;
        switch (type) {
            case NUMBER: {
                BigDecimal number = raw.isNumber() ? raw.decimalValue() : parseNumber(plain);
                return number != null
                        ? new AttributeValue(AttributeDataType.NUMBER, number.stripTrailingZeros().toPlainString())
                        : text(plain);
            }
            case BOOLEAN: {
                Boolean bool = raw.isBoolean() ? Boolean.valueOf(raw.booleanValue()) : parseBoolean(plain);
                return bool != null
                        ? new AttributeValue(AttributeDataType.BOOLEAN, bool ? "Yes" : "No")
                        : text(plain);
            }
            case DATE: {
                LocalDate date = parseDate(plain);
                return date != null
                        ? new AttributeValue(AttributeDataType.DATE, date.toString())
                        : text(plain);
            }
            default:
                return text(plain);
        }
    }

    private static String plainText(JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) return null;
        if (raw.isArray()) {
            List<String> items = new ArrayList<>();
            for (JsonNode item : raw) {
                String s = plainText(item);
                if (s != null && !s.isBlank()) items.add(s.trim());
            }
            return String.join(", ", items);
        }
        if (raw.isObject()) return raw.toString();
        if (raw.isNumber()) return raw.decimalValue().stripTrailingZeros().toPlainString();
        return raw.asText().trim();
    }

    private static BigDecimal parseNumber(String s) {
        try {
            return new BigDecimal(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Boolean parseBoolean(String s) {
        switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
            case "1":
                return Boolean.TRUE;
            case "false":
            case "no":
            case "0":
                return Boolean.FALSE;
            default:
                return null;
        }
    }

    private static LocalDate parseDate(String s) {
        try {
            return LocalDate.parse(s.trim());
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(s.trim()).toLocalDate();
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }
}
