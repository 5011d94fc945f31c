package com.legalgraph.dto.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Document {

    private String id;

    private String corpusId;

    private String sourceUrl;

    private String displayTitle;

    @Builder.Default
    private List<String> body = new ArrayList<>();

    private int wordCount;

    /**
     * Paragraphs joined with a newline; citation offsets refer to this text.
     */
    public String searchableText() {
        return body == null ? "" : String.join("\n", body);
    }

    public static int countWords(List<String> paragraphs) {
        int count = 0;
        if (paragraphs == null) {
            return count;
        }
        for (String paragraph : paragraphs) {
            if (paragraph == null || paragraph.isBlank()) {
                continue;
            }
            count += paragraph.trim().split("\\s+").length;
        }
        return count;
    }
}
