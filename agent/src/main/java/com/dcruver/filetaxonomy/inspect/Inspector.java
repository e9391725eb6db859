package com.dcruver.filetaxonomy.inspect;

import com.dcruver.filetaxonomy.domain.ScannedFile;

/**
 * Extracts content signals (text, tags, duration) from a file.
 */
public interface Inspector {

    ContentSignal inspect(ScannedFile file) throws InspectionException;
}
