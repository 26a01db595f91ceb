package com.wshg.productsearch.service;

import com.wshg.productsearch.config.ProductSearchProperties;
import com.wshg.productsearch.document.ContentChunk;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 将向量文本切分为不超过上限的分块。
 * 上限按 maxTokensPerChunk * 4 个字符估算；按段落、行、句子、单词逐级切分后贪心合并，
 * 不产生空块，不在单词中间断开。多块时每块带 "Title: ..." 前缀，标题过长时截短而不是去掉。
 */
@Service
@RequiredArgsConstructor
public class ContentChunker {

    static final int CHARS_PER_TOKEN = 4;
    private static final String TITLE_LABEL = "Title: ";

    private static final Level[] LEVELS = {
            new Level(Pattern.compile("\\n\\s*\\n"), "\n\n"),
            new Level(Pattern.compile("\\n"), "\n"),
            new Level(Pattern.compile("(?<=[.!?。！？])\\s+"), " "),
            new Level(Pattern.compile("\\s+"), " ")
    };

    private final ProductSearchProperties props;

    public List<ContentChunk> chunk(String text, String title) {
        if (text == null || text.isBlank()) return List.of();
        String content = text.trim();
        int maxChars = getMaxChars();
        if (content.length() <= maxChars) {
            return List.of(new ContentChunk(0, content));
        }

        String prefix = titlePrefix(title, maxChars / 2);
        int budget = maxChars - prefix.length();

        List<String> pieces = new ArrayList<>();
        pack(content, 0, budget, pieces);

        List<ContentChunk> chunks = new ArrayList<>(pieces.size());
        for (String piece : pieces) {
            chunks.add(new ContentChunk(chunks.size(), prefix + piece));
        }
        return chunks;
    }

    /**
     * 每个分块的标题前缀，最多占一半预算；标题过长时在单词边界截断。
     * 预算小到放不下任何标题字符时返回空串。
     */
    static String titlePrefix(String title, int maxPrefixChars) {
        if (title == null || title.isBlank()) return "";
        String t = title.trim();
        int maxTitle = maxPrefixChars - TITLE_LABEL.length() - 1;
        if (maxTitle < 1) return "";
        if (t.length() > maxTitle) {
            String cut = t.substring(0, maxTitle);
            int space = cut.lastIndexOf(' ');
            t = (space > 0 ? cut.substring(0, space) : cut).trim();
        }
        return TITLE_LABEL + t + "\n";
    }

    public int estimateTokenCount(String text) {
        if (text == null || text.isBlank()) return 0;
        return (int) Math.ceil(text.length() / (double) CHARS_PER_TOKEN);
    }

    public int getMaxChars() {
        return Math.max(1, props.getMaxTokensPerChunk()) * CHARS_PER_TOKEN;
    }

    private void pack(String text, int level, int budget, List<String> out) {
        if (text.length() <= budget || level >= LEVELS.length) {
            // 超长的单个单词单独成块
            out.add(text);
            return;
        }
        Level splitter = LEVELS[level];
        StringBuilder current = new StringBuilder();
        for (String raw : splitter.pattern.split(text)) {
            String part = raw.trim();
            if (part.isEmpty()) continue;
            if (part.length() > budget) {
                flush(current, out);
                pack(part, level + 1, budget, out);
                continue;
            }
            if (current.length() == 0) {
                current.append(part);
            } else if (current.length() + splitter.joiner.length() + part.length() <= budget) {
                current.append(splitter.joiner).append(part);
            } else {
                flush(current, out);
                current.append(part);
            }
        }
        flush(current, out);
    }

    private static void flush(StringBuilder current, List<String> out) {
        if (current.length() > 0) {
            out.add(current.toString());
            current.setLength(0);
        }
    }

    private static final class Level {
        private final Pattern pattern;
        private final String joiner;

        private Level(Pattern pattern, String joiner) {
            this.pattern = pattern;
            this.joiner = joiner;
        }
    }
}
