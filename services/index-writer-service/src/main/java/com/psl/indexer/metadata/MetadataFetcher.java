package com.psl.indexer.metadata;

import com.psl.schema.identifier.PaperIdentifier;

public interface MetadataFetcher {
    /**
     * Fetches every version of the identified paper, whether or not the identifier pins a version.
     *
     * @throws PaperNotFoundException when the metadata source does not know the paper
     * @throws MetadataFetchException on transport failures and upstream errors
     */
    PaperVersions fetch(PaperIdentifier identifier);
}
