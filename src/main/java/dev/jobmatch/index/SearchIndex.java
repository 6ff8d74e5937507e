package dev.jobmatch.index;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Port to the external search index holding the job and candidate collections.
 *
 * <p>Reads are eventually consistent: a document written just before a search may not be visible
 * to it yet.
 */
public interface SearchIndex {

  /**
   * Fetches one document by id.
   *
   * @param collection the collection to read from
   * @param id the document id
   * @param type the class the document source is bound to
   * @return the document, or empty if no document has that id
   * @throws SearchIndexUnavailableException if the index cannot be reached
   */
  <T> Optional<T> getDocument(IndexCollection collection, String id, Class<T> type);

  /**
   * Fetches several documents in one round trip. Ids without a document are absent from the result.
   *
   * @return documents keyed by id
   */
  <T> Map<String, T> getDocuments(IndexCollection collection, Collection<String> ids, Class<T> type);

  /**
   * Runs a match query and returns at most {@code maxResults} hits in the index's ranking order.
   */
  List<IndexHit> search(IndexCollection collection, MatchQuery query, int maxResults);

  /** Writes a document and makes it visible to search before returning. */
  void putDocument(IndexCollection collection, String id, Object document);

  /** Reports cluster health. Never throws: an unreachable cluster yields an unreachable result. */
  IndexHealth health();
}
