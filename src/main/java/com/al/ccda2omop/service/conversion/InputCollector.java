package com.al.ccda2omop.service.conversion;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves the conversion input: a single file, or the {@code .xml} files
 * of a directory in name order.
 */
@Component
public class InputCollector {

    public List<Path> collect(Path input) throws IOException {
        if (!Files.exists(input)) {
            throw new IllegalArgumentException("Input path does not exist: " + input);
        }
        if (!Files.isDirectory(input)) {
            return List.of(input);
        }
        try (Stream<Path> listing = Files.list(input)) {
            return listing
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".xml"))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
