package com.adlanda.contextassembler.service;

import java.io.IOException;

/**
 * Reads the text content of a project-relative path.
 */
@FunctionalInterface
public interface FileContentReader {

    String read(String path) throws IOException;
}
