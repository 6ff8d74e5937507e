package dev.jobmatch.api;

import dev.jobmatch.matching.DocumentService;
import dev.jobmatch.profile.DocumentType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Returns a single job or candidate by id. */
@RestController
public class DocumentController {

  private final DocumentService documentService;

  public DocumentController(DocumentService documentService) {
    this.documentService = documentService;
  }

  /**
   * Looks up a document.
   *
   * @param id the document id
   * @param docType {@code job} or {@code candidate}, case-insensitive
   * @return a {@link JobView} or a {@link CandidateView}
   */
  @GetMapping("/document")
  public Object getDocument(
      @RequestParam String id, @RequestParam(name = "doc_type") String docType) {
    return switch (DocumentType.fromValue(docType)) {
      case JOB -> JobView.from(documentService.getJob(id));
      case CANDIDATE -> CandidateView.from(documentService.getCandidate(id));
    };
  }
}
