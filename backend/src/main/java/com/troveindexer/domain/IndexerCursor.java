package com.troveindexer.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Last fully processed block for one indexer instance. Sole recovery checkpoint of the tailing loop.
 */
@Document(collection = "indexer_cursor")
@NoArgsConstructor
@Getter
@Setter
public class IndexerCursor {

    @Id
    private String id;
    private long lastProcessedBlock;
    private Instant updatedAt;
}
