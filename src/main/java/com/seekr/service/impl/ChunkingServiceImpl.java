package com.seekr.service.impl;

import cn.hutool.core.util.StrUtil;
import com.seekr.config.RAGConfig;
import com.seekr.exception.BusinessException;
import com.seekr.model.dto.RetrievalSettings;
import com.seekr.model.dto.TextChunk;
import com.seekr.service.ChunkingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 文档分块服务实现
 *
 * @author seekr
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChunkingServiceImpl implements ChunkingService {

    private final RAGConfig ragConfig;

    // 表格标题行,如 [Table 1 on page 3]
    private static final Pattern TABLE_CAPTION = Pattern.compile("^\\s*\\[Table \\d+ on page \\d+]\\s*$");

    // Markdown 表格分隔行,如 |---|:---:|
    private static final Pattern TABLE_RULE = Pattern.compile("^\\s*\\|?\\s*:?-{3,}.*$");

    @Override
    public List<TextChunk> chunk(String text) {
        RetrievalSettings settings = ragConfig.toSettings();
        return chunk(text, settings.getChunkSize(), settings.getChunkOverlap(), settings.getSeparators());
    }

    @Override
    public List<TextChunk> chunk(String text, int chunkSize, int overlap, List<String> separators) {
        if (chunkSize <= 0) {
            throw BusinessException.invalid("chunkSize 必须大于 0");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw BusinessException.invalid("overlap 必须在 [0, chunkSize) 之间: overlap=" + overlap);
        }
        if (StrUtil.isBlank(text)) {
            return new ArrayList<>();
        }

        String normalized = text.replace("\r\n", "\n").strip();
        List<Block> blocks = splitBlocks(normalized);
        List<TextChunk> chunks = new ArrayList<>();

        if (normalized.length() <= chunkSize) {
            boolean hasTable = blocks.stream().anyMatch(Block::isTable);
            chunks.add(new TextChunk(0, normalized, hasTable));
            return chunks;
        }

        for (Block block : blocks) {
            List<String> pieces = block.isTable()
                    ? splitTable(block.getLines(), chunkSize)
                    : chunkTextRun(block.text(), chunkSize, overlap, separators);
            for (String piece : pieces) {
                chunks.add(new TextChunk(chunks.size(), piece, block.isTable()));
            }
        }

        log.debug("分块完成: chars={}, chunks={}, tables={}", normalized.length(), chunks.size(),
                blocks.stream().filter(Block::isTable).count());
        return chunks;
    }

    /**
     * 普通文本: 先切成不超过 (chunkSize - overlap) 的片段,再给后续片段加上前一块的末尾作为重叠
     */
    private List<String> chunkTextRun(String text, int chunkSize, int overlap, List<String> separators) {
        List<String> pieces = new ArrayList<>();
        for (String piece : splitRecursive(text, separators, 0, chunkSize - overlap)) {
            String trimmed = piece.strip();
            if (!trimmed.isEmpty()) {
                pieces.add(trimmed);
            }
        }

        List<String> chunks = new ArrayList<>(pieces.size());
        String previous = null;
        for (String piece : pieces) {
            String content = previous == null ? piece : tail(previous, overlap) + piece;
            chunks.add(content);
            previous = content;
        }
        return chunks;
    }

    private List<String> splitRecursive(String text, List<String> separators, int level, int maxChars) {
        List<String> result = new ArrayList<>();
        if (text.length() <= maxChars) {
            result.add(text);
            return result;
        }
        if (level >= separators.size()) {
            for (int start = 0; start < text.length(); start += maxChars) {
                result.add(text.substring(start, Math.min(text.length(), start + maxChars)));
            }
            return result;
        }
        String separator = separators.get(level);
        if (separator.isEmpty() || !text.contains(separator)) {
            return splitRecursive(text, separators, level + 1, maxChars);
        }

        StringBuilder current = new StringBuilder();
        for (String part : splitKeepingSeparator(text, separator)) {
            if (part.length() > maxChars) {
                flush(current, result);
                result.addAll(splitRecursive(part, separators, level + 1, maxChars));
            } else if (current.length() + part.length() > maxChars) {
                flush(current, result);
                current.append(part);
            } else {
                current.append(part);
            }
        }
        flush(current, result);
        return result;
    }

    private static List<String> splitKeepingSeparator(String text, String separator) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        int idx;
        while ((idx = text.indexOf(separator, start)) >= 0) {
            parts.add(text.substring(start, idx + separator.length()));
            start = idx + separator.length();
        }
        if (start < text.length()) {
            parts.add(text.substring(start));
        }
        return parts;
    }

    private static void flush(StringBuilder current, List<String> result) {
        if (current.length() > 0) {
            result.add(current.toString());
            current.setLength(0);
        }
    }

    private static String tail(String text, int n) {
        return n <= 0 ? "" : text.substring(Math.max(0, text.length() - n));
    }

    /**
     * 表格: 能放下则整体一块,否则按行切分,每块重复表头(标题行 + 首行 + 分隔行)
     */
    private List<String> splitTable(List<String> lines, int chunkSize) {
        String whole = String.join("\n", lines);
        List<String> pieces = new ArrayList<>();
        if (whole.length() <= chunkSize) {
            pieces.add(whole);
            return pieces;
        }

        int headerEnd = 0;
        if (TABLE_CAPTION.matcher(lines.get(0)).matches()) {
            headerEnd++;
        }
        if (headerEnd < lines.size()) {
            headerEnd++;
        }
        if (headerEnd < lines.size() && TABLE_RULE.matcher(lines.get(headerEnd)).matches()) {
            headerEnd++;
        }
        String header = String.join("\n", lines.subList(0, headerEnd));
        List<String> rows = lines.subList(headerEnd, lines.size());
        if (rows.isEmpty()) {
            pieces.add(header);
            return pieces;
        }

        StringBuilder current = new StringBuilder(header);
        int rowsInCurrent = 0;
        for (String row : rows) {
            if (rowsInCurrent > 0 && current.length() + 1 + row.length() > chunkSize) {
                pieces.add(current.toString());
                current = new StringBuilder(header);
                rowsInCurrent = 0;
            }
            current.append('\n').append(row);
            rowsInCurrent++;
        }
        pieces.add(current.toString());
        log.debug("超长表格按行切分: rows={}, pieces={}", rows.size(), pieces.size());
        return pieces;
    }

    /**
     * 将文本切分为普通文本块和表格块,保持原顺序
     */
    private List<Block> splitBlocks(String text) {
        String[] lines = text.split("\n", -1);
        List<Block> blocks = new ArrayList<>();
        List<String> textLines = new ArrayList<>();
        int i = 0;
        while (i < lines.length) {
            int end = tableEnd(lines, i);
            if (end > i) {
                if (!String.join("\n", textLines).isBlank()) {
                    blocks.add(new Block(false, new ArrayList<>(textLines)));
                }
                textLines.clear();
                List<String> tableLines = new ArrayList<>();
                for (int j = i; j < end; j++) {
                    tableLines.add(lines[j].strip());
                }
                blocks.add(new Block(true, tableLines));
                i = end;
            } else {
                textLines.add(lines[i]);
                i++;
            }
        }
        if (!String.join("\n", textLines).isBlank()) {
            blocks.add(new Block(false, textLines));
        }
        return blocks;
    }

    /**
     * 从 start 开始的表格结束位置(不含),不是表格时返回 start
     */
    private static int tableEnd(String[] lines, int start) {
        boolean captioned = TABLE_CAPTION.matcher(lines[start]).matches();
        int j = captioned ? start + 1 : start;
        while (j < lines.length && isRow(lines[j])) {
            j++;
        }
        int rows = j - (captioned ? start + 1 : start);
        if (captioned ? rows >= 1 : rows >= 2) {
            return j;
        }
        return start;
    }

    private static boolean isRow(String line) {
        return !line.isBlank() && line.indexOf('|') >= 0;
    }

    private static final class Block {

        private final boolean table;
        private final List<String> lines;

        private Block(boolean table, List<String> lines) {
            this.table = table;
            this.lines = lines;
        }

        boolean isTable() {
            return table;
        }

        List<String> getLines() {
            return lines;
        }

        String text() {
            return String.join("\n", lines);
        }
    }
}
