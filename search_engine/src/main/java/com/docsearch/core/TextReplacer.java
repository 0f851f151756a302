package com.docsearch.core;

import com.docsearch.dto.EngineResponse;
import com.docsearch.dto.ReplaceResult;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Whole-word find and replace over raw text. A word matches when its
 * normalized form equals the normalized search word; the replacement is
 * inserted verbatim. Whitespace between words is kept as is.
 */
final class TextReplacer {

    private static final Pattern WORD = Pattern.compile("\\S+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextReplacer() {}

    static EngineResponse<ReplaceResult> replaceAll(String content, String findWord, String replaceWord) {
        if (Normalizer.isBlank(content)) {
            return EngineResponse.validation("content missing");
        }
        if (Normalizer.isBlank(findWord)) {
            return EngineResponse.validation("find word missing");
        }
        // an empty replacement deletes the matched words
        if (replaceWord == null) {
            return EngineResponse.validation("replace word missing");
        }

        Optional<String> target = Normalizer.normalize(findWord);
        if (target.isEmpty()) {
            // same as a keyword search for it: nothing matches
            return EngineResponse.ok(new ReplaceResult(findWord, replaceWord, content, 0));
        }

        StringBuilder out = new StringBuilder(content.length());
        int replaced = 0;
        int last = 0;

        Matcher m = WORD.matcher(content);
        while (m.find()) {
            out.append(content, last, m.start());
            String word = m.group();
            if (Normalizer.normalize(word).filter(target.get()::equals).isPresent()) {
                out.append(replaceWord);
                replaced++;
            } else {
                out.append(word);
            }
            last = m.end();
        }
        out.append(content, last, content.length());

        return EngineResponse.ok(new ReplaceResult(findWord, replaceWord, out.toString(), replaced));
    }
}
