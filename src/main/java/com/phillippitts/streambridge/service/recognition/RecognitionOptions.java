package com.phillippitts.streambridge.service.recognition;

import com.phillippitts.streambridge.config.properties.BackendProperties;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Per-stream recognition options sent to the backend when a stream is opened.
 *
 * @param languageCode      BCP-47 language, e.g. {@code en-US}
 * @param enablePartials    whether interim hypotheses are requested
 * @param enableWordOffsets whether finals carry word timings
 * @param enablePunctuation whether automatic punctuation is requested
 * @param hotwords          phrases to boost
 */
public record RecognitionOptions(
        String languageCode,
        boolean enablePartials,
        boolean enableWordOffsets,
        boolean enablePunctuation,
        List<String> hotwords
) {

    public RecognitionOptions {
        Objects.requireNonNull(languageCode, "languageCode");
        hotwords = hotwords == null ? List.of() : List.copyOf(hotwords);
    }

    public static RecognitionOptions from(BackendProperties props) {
        return new RecognitionOptions(props.getLanguageCode(), true, props.isEnableWordOffsets(),
                props.isEnablePunctuation(), props.getHotwords());
    }

    public RecognitionOptions withPartials(boolean enabled) {
        return new RecognitionOptions(languageCode, enabled, enableWordOffsets, enablePunctuation, hotwords);
    }

    public RecognitionOptions withLanguageCode(String language) {
        return new RecognitionOptions(language, enablePartials, enableWordOffsets, enablePunctuation, hotwords);
    }

    /**
     * Returns options whose hotwords are this instance's followed by {@code extra}, without duplicates.
     *
     * @param extra additional hotwords
     * @return merged options
     */
    public RecognitionOptions withAdditionalHotwords(List<String> extra) {
        Set<String> merged = new LinkedHashSet<>(hotwords);
        merged.addAll(extra);
        return new RecognitionOptions(languageCode, enablePartials, enableWordOffsets, enablePunctuation,
                List.copyOf(merged));
    }
}
