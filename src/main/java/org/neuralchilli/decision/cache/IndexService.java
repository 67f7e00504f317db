package org.neuralchilli.decision.cache;

import java.util.Optional;

/**
 * Remote index mapping dotted paths to task ids.
 */
public interface IndexService {

    /**
     * Task indexed at {@code indexPath}.
     *
     * @return empty only when the index confirms nothing is stored there
     * @throws org.neuralchilli.decision.service.IndexLookupException for any other failure
     */
    Optional<String> findTask(String indexPath);

    /**
     * Index an existing task at {@code indexPath}, replacing any previous entry.
     */
    void insertTask(String indexPath, String taskId);
}
