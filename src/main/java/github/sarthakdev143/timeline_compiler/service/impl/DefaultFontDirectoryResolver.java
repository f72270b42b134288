package github.sarthakdev143.timeline_compiler.service.impl;

import github.sarthakdev143.timeline_compiler.config.TimelineCompilerProperties;
import github.sarthakdev143.timeline_compiler.exception.MissingAssetException;
import github.sarthakdev143.timeline_compiler.service.FontDirectoryResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Looks up font families in the configured font directories by file name. A family is found in a directory when a
 * {@code .ttf}/{@code .otf} file there contains the family name, ignoring case and spaces.
 */
@Component
public class DefaultFontDirectoryResolver implements FontDirectoryResolver {

    private static final Logger logger = LoggerFactory.getLogger(DefaultFontDirectoryResolver.class);

    private final TimelineCompilerProperties properties;

    public DefaultFontDirectoryResolver(TimelineCompilerProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<Path> resolve(List<String> fontFamilies) {
        if (fontFamilies == null || fontFamilies.isEmpty()) {
            return List.of();
        }

        List<Path> directories = configuredDirectories();
        Set<Path> resolved = new LinkedHashSet<>();
        for (String family : fontFamilies) {
            String wanted = normalize(family);
            boolean found = false;
            for (Path directory : directories) {
                if (containsFont(directory, wanted)) {
                    resolved.add(directory);
                    found = true;
                }
            }
            if (!found) {
                logger.warn("Font family '{}' not found in {}, the subtitle renderer will substitute it", family, directories);
            }
        }
        return new ArrayList<>(resolved);
    }

    private List<Path> configuredDirectories() {
        List<Path> directories = new ArrayList<>();
        for (String configured : properties.getFontDirectories()) {
            Path directory = Path.of(configured);
            if (!Files.isDirectory(directory)) {
                throw new MissingAssetException("Font directory", directory);
            }
            directories.add(directory);
        }
        return directories;
    }

    private boolean containsFont(Path directory, String wanted) {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .map(file -> file.getFileName().toString().toLowerCase(Locale.ROOT))
                    .filter(name -> name.endsWith(".ttf") || name.endsWith(".otf"))
                    .anyMatch(name -> normalize(name).contains(wanted));
        } catch (IOException ex) {
            logger.warn("Could not list font directory {}: {}", directory, ex.getMessage());
            return false;
        }
    }

    private static String normalize(String value) {
        return value.toLowerCase(Locale.ROOT).replace(" ", "").replace("-", "").replace("_", "");
    }
}
