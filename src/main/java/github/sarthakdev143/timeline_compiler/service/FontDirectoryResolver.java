package github.sarthakdev143.timeline_compiler.service;

import java.nio.file.Path;
import java.util.List;

public interface FontDirectoryResolver {

    /**
     * Maps font family names to local directories that hold them, in search order.
     */
    List<Path> resolve(List<String> fontFamilies);
}
