package com.adlanda.contextassembler.service;

import com.adlanda.contextassembler.model.FileTree;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FileTreeRendererTest {

    private final FileTreeRenderer renderer = new FileTreeRenderer();

    @Test
    void render_directoriesBeforeFilesSortedByName() {
        FileTree tree = FileTree.of(List.of("setup.py", "src/util/io.py", "src/main.py", "README.md"));

        String rendered = renderer.render(tree);

        assertThat(rendered).isEqualTo("""
                Project File Structure:
                ├── src/
                │   ├── util/
                │   │   └── io.py
                │   └── main.py
                ├── README.md
                └── setup.py
                """);
    }

    @Test
    void render_emptyTree_isJustTheHeader() {
        assertThat(renderer.render(FileTree.empty())).isEqualTo(FileTreeRenderer.HEADER);
    }
}
