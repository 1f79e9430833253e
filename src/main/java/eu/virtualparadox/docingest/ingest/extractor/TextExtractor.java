package eu.virtualparadox.docingest.ingest.extractor;

import eu.virtualparadox.docingest.ingest.model.DocumentType;
import eu.virtualparadox.docingest.ingest.model.ExtractedDocument;

public interface TextExtractor {

    /**
     * @return the document's full text, possibly blank
     * @throws eu.virtualparadox.docingest.ingest.exception.DocumentExtractionException if the content is malformed
     */
    String extractText(final byte[] content, final DocumentType type);

    /**
     * @return the full text together with page records whose offsets index into it
     * @throws eu.virtualparadox.docingest.ingest.exception.DocumentExtractionException if the content is malformed
     */
    ExtractedDocument extractWithPages(final byte[] content, final DocumentType type);

}
