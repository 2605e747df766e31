package com.adlanda.contextassembler.service.selection;

import com.adlanda.contextassembler.service.FileContentReader;
import com.adlanda.contextassembler.service.UsageLedger;

import java.util.Optional;

/**
 * What a strategy may consult besides the file tree.
 *
 * @param readme        README text, or null
 * @param contentReader Reads file contents by relative path
 * @param ledger        Usage ledger of the current run
 */
public record SelectionContext(String readme, FileContentReader contentReader, UsageLedger ledger) {

    public Optional<String> readmeContent() {
        return Optional.ofNullable(readme).filter(r -> !r.isBlank());
    }
}
