package com.seekr.service.impl;

import com.seekr.config.RAGConfig;
import com.seekr.exception.BusinessException;
import com.seekr.model.dto.TextChunk;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkingServiceImplTest {

    private static final List<String> SEPARATORS = List.of("\n\n", "\n", ". ", " ");

    private final ChunkingServiceImpl chunkingService = new ChunkingServiceImpl(new RAGConfig());

    @Test
    void blankTextYieldsNoChunks() {
        assertThat(chunkingService.chunk("")).isEmpty();
        assertThat(chunkingService.chunk(" \n\t ")).isEmpty();
    }

    @Test
    void shortTextIsSingleChunk() {
        List<TextChunk> chunks = chunkingService.chunk("  A short note about retrieval.\r\n", 200, 40, SEPARATORS);

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).getIndex()).isZero();
        assertThat(chunks.get(0).getContent()).isEqualTo("A short note about retrieval.");
        assertThat(chunks.get(0).isContainsTable()).isFalse();
    }

    @Test
    void longTextRespectsSizeAndOverlap() {
        String text = IntStream.range(0, 40)
                .mapToObj(i -> "Sentence number " + i + " describes how the retrieval pipeline ranks passages.")
                .collect(Collectors.joining(" "));

        List<TextChunk> chunks = chunkingService.chunk(text, 200, 40, SEPARATORS);

        assertThat(chunks.size()).isGreaterThan(5);
        for (int i = 0; i < chunks.size(); i++) {
            TextChunk chunk = chunks.get(i);
            assertThat(chunk.getIndex()).isEqualTo(i);
            assertThat(chunk.getCharLength()).isLessThanOrEqualTo(200);
            if (i > 0) {
                String previous = chunks.get(i - 1).getContent();
                String tail = previous.substring(Math.max(0, previous.length() - 40));
                assertThat(chunk.getContent()).startsWith(tail);
            }
        }
        assertThat(chunks.get(chunks.size() - 1).getContent()).endsWith("Sentence number 39 describes how the retrieval pipeline ranks passages.");
    }

    @Test
    void textWithoutSeparatorsIsHardSplit() {
        String text = "x".repeat(500);

        List<TextChunk> chunks = chunkingService.chunk(text, 200, 40, SEPARATORS);

        assertThat(chunks).hasSize(4);
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.getCharLength()).isLessThanOrEqualTo(200));
        assertThat(chunks.get(0).getContent()).hasSize(160);
    }

    @Test
    void smallTableStaysInOneChunk() {
        String table = """
                [Table 1 on page 2]
                | Service | Price |
                |---|---|
                | Guarding | 40 |
                | Patrol | 25 |""";
        String text = "Intro paragraph. ".repeat(15) + "\n\n" + table + "\n\n" + "Closing remarks. ".repeat(15);

        List<TextChunk> chunks = chunkingService.chunk(text, 200, 20, SEPARATORS);

        List<TextChunk> tableChunks = chunks.stream().filter(TextChunk::isContainsTable).toList();
        assertThat(tableChunks).hasSize(1);
        assertThat(tableChunks.get(0).getContent()).isEqualTo(table);
    }

    @Test
    void oversizedTableIsSplitByRowsWithRepeatedHeader() {
        String header = "[Table 3 on page 7]\n| Region | Contract | Hours |\n|---|---|---|";
        String rows = IntStream.range(0, 25)
                .mapToObj(i -> "| region-" + i + " | contract-" + i + " | " + (i * 8) + " |")
                .collect(Collectors.joining("\n"));
        String text = "Staffing overview for the year.\n\n" + header + "\n" + rows;

        List<TextChunk> chunks = chunkingService.chunk(text, 220, 30, SEPARATORS);

        List<TextChunk> tableChunks = chunks.stream().filter(TextChunk::isContainsTable).toList();
        assertThat(tableChunks.size()).isGreaterThan(1);
        for (TextChunk chunk : tableChunks) {
            assertThat(chunk.getContent()).startsWith(header + "\n");
            assertThat(chunk.getCharLength()).isLessThanOrEqualTo(220);
            for (String line : chunk.getContent().split("\n")) {
                assertThat(line).satisfiesAnyOf(
                        l -> assertThat(header).contains(l),
                        l -> assertThat(l).matches("\\| region-\\d+ \\| contract-\\d+ \\| \\d+ \\|"));
            }
        }
        String joined = tableChunks.stream().map(TextChunk::getContent).collect(Collectors.joining("\n"));
        for (int i = 0; i < 25; i++) {
            assertThat(joined).contains("| region-" + i + " | contract-" + i + " | " + (i * 8) + " |");
        }
        assertThat(chunks.get(0).isContainsTable()).isFalse();
    }

    @Test
    void rejectsOverlapNotSmallerThanChunkSize() {
        assertThatThrownBy(() -> chunkingService.chunk("some text", 100, 100, SEPARATORS))
                .isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> chunkingService.chunk("some text", 100, -1, SEPARATORS))
                .isInstanceOf(BusinessException.class);
    }
}
