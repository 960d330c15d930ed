package io.quarkus.qe.git.content.search.locate;

import java.util.List;

/**
 * Finds where a file lives, or used to live, in the repository history.
 */
public interface FileLocator {

    /**
     * Paths whose file name equals the given name, or that contain it, ignoring case.
     * Exact file name matches come first.
     */
    List<LocatedFile> locate(String fileName);

}
