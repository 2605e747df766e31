package com.adlanda.contextassembler.service;

import com.adlanda.contextassembler.model.FileTree;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;

/**
 * Renders a file tree as box-drawing text, directories before files, both sorted by name.
 */
@Component
public class FileTreeRenderer {

    static final String HEADER = "Project File Structure:\n";

    public String render(FileTree fileTree) {
        Node root = new Node();
        for (String path : fileTree.paths()) {
            Node node = root;
            String[] segments = path.split("/");
            for (int i = 0; i < segments.length - 1; i++) {
                node = node.directories.computeIfAbsent(segments[i], k -> new Node());
            }
            node.files.put(segments[segments.length - 1], Boolean.TRUE);
        }

        StringBuilder out = new StringBuilder(HEADER);
        appendChildren(root, "", out);
        return out.toString();
    }

    private void appendChildren(Node node, String prefix, StringBuilder out) {
        int remaining = node.directories.size() + node.files.size();
        for (Map.Entry<String, Node> dir : node.directories.entrySet()) {
            boolean last = --remaining == 0;
            out.append(prefix).append(last ? "└── " : "├── ").append(dir.getKey()).append("/\n");
            appendChildren(dir.getValue(), prefix + (last ? "    " : "│   "), out);
        }
        for (String file : node.files.keySet()) {
            boolean last = --remaining == 0;
            out.append(prefix).append(last ? "└── " : "├── ").append(file).append('\n');
        }
    }

    private static final class Node {
        final Map<String, Node> directories = new TreeMap<>();
        final Map<String, Boolean> files = new TreeMap<>();
    }
}
