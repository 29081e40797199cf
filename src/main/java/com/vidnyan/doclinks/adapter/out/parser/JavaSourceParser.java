package com.vidnyan.doclinks.adapter.out.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Parses Java source files into syntax trees.
 * Comments are not attributed to nodes, so Javadoc and line comments never reach the fingerprint.
 * A file that cannot be decoded as UTF-8 or parsed is reported and yields nothing.
 */
@Slf4j
@Component
public class JavaSourceParser {

    public Optional<ParsedSource> parse(Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            log.warn("Skipping {}: not valid UTF-8", file);
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Skipping {}: {}", file, e.getMessage());
            return Optional.empty();
        }

        // JavaParser instances are not thread-safe; the indexer parses in parallel
        ParseResult<CompilationUnit> result = newParser().parse(content);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problem = result.getProblems().isEmpty()
                    ? "no result"
                    : result.getProblems().get(0).getMessage();
            log.warn("Skipping {}: {}", file, safeMsg(problem));
            return Optional.empty();
        }
        return Optional.of(new ParsedSource(file, content, result.getResult().get()));
    }

    private static JavaParser newParser() {
        return new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setAttributeComments(false));
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
