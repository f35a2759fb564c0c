package com.glyphlate.backend.services.translation;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.glyphlate.backend.config.ImageTranslationProperties;
import com.glyphlate.backend.services.ocr.TextBlock;

import lombok.extern.slf4j.Slf4j;

/**
 * Translates OCR blocks in fixed-size chunks. Blocks of one chunk are translated concurrently;
 * the next chunk starts only after the whole previous chunk resolved. A failing block falls back
 * to its source text and never fails the batch.
 */
@Service
@Slf4j
public class BatchTranslator {

    private final PivotTranslationClient translationClient;
    private final Executor executor;
    private final int batchSize;

    @Autowired
    public BatchTranslator(
            PivotTranslationClient translationClient,
            @Qualifier("translationTaskExecutor") Executor executor,
            ImageTranslationProperties properties
    ) {
        this(translationClient, executor, properties.getTranslation().getBatchSize());
    }

    BatchTranslator(PivotTranslationClient translationClient, Executor executor, int batchSize) {
        this.translationClient = translationClient;
        this.executor = executor;
        this.batchSize = Math.max(1, batchSize);
    }

    /**
     * @param scale factor the OCR image was downsampled by; geometry of translated blocks is
     *              mapped back by dividing by it when it is not 1
     * @return one block per input block, same order
     */
    public List<TranslatedBlock> translateBlocks(List<TextBlock> blocks, String fromLang, String toLang, double scale) {
        List<TranslatedBlock> results = new ArrayList<>(blocks.size());

        for (int i = 0; i < blocks.size(); i += batchSize) {
            List<TextBlock> chunk = blocks.subList(i, Math.min(i + batchSize, blocks.size()));

            List<CompletableFuture<TranslatedBlock>> futures = chunk.stream()
                    .map(block -> CompletableFuture.supplyAsync(
                            () -> translateBlock(block, fromLang, toLang, scale),
                            executor
                    ))
                    .toList();

            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
            for (CompletableFuture<TranslatedBlock> future : futures) {
                results.add(future.join());
            }

            if (i + batchSize < blocks.size()) {
                log.debug("[Translate] Chunk {} done, {}/{} blocks", i / batchSize + 1, results.size(), blocks.size());
            }
        }

        return results;
    }

    private TranslatedBlock translateBlock(TextBlock block, String fromLang, String toLang, double scale) {
        try {
            String translated = translationClient.translate(fromLang, toLang, block.text(), false);
            log.debug("[Translate] \"{}\" -> \"{}\"", abbreviate(block.text()), abbreviate(translated));

            return scale != 1
                    ? TranslatedBlock.unscaled(block, scale, translated)
                    : TranslatedBlock.of(block, translated);
        } catch (Exception e) {
            log.warn("[Translate] Failed to translate block \"{}\": {}", abbreviate(block.text()), e.getMessage());
            return TranslatedBlock.of(block, block.text());
        }
    }

    private static String abbreviate(String text) {
        if (text == null) return "";
        return text.length() <= 30 ? text : text.substring(0, 30) + "...";
    }
}
