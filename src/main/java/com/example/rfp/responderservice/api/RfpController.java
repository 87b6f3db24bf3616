package com.example.rfp.responderservice.api;

import com.example.rfp.responderservice.dto.EditAnswerRequest;
import com.example.rfp.responderservice.dto.RfpSessionResponse;
import com.example.rfp.responderservice.model.AnsweredQuestion;
import com.example.rfp.responderservice.model.RfpProcessingResult;
import com.example.rfp.responderservice.model.RfpSession;
import com.example.rfp.responderservice.service.ResponseAssembler;
import com.example.rfp.responderservice.service.ResponseDocumentWriter;
import com.example.rfp.responderservice.service.RfpProcessingService;
import com.example.rfp.responderservice.service.RfpSessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.NoSuchElementException;

@Slf4j
@RestController
@RequestMapping("/api/rfp")
@RequiredArgsConstructor
public class RfpController {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final RfpProcessingService rfpProcessingService;
    private final RfpSessionService rfpSessionService;
    private final ResponseAssembler responseAssembler;
    private final ResponseDocumentWriter documentWriter;
    private final Clock clock;

    @PostMapping(consumes = "multipart/form-data")
    public RfpSessionResponse process(@RequestParam("file") MultipartFile file,
                                      @RequestParam(value = "projectName", required = false) String projectName)
            throws IOException {
        String fileName = file.getOriginalFilename();
        RfpProcessingResult result = rfpProcessingService.processFile(fileName, file.getBytes(),
                p -> log.debug("[{}] {}/{} {}", p.stage(), p.currentItem(), p.totalItems(), p.message()),
                Thread.currentThread()::isInterrupted);
        return RfpSessionResponse.from(rfpSessionService.start(projectName, fileName, result));
    }

    @GetMapping
    public RfpSessionResponse current() {
        return RfpSessionResponse.from(rfpSessionService.require());
    }

    @PutMapping("/questions/{index}/answer")
    public RfpSessionResponse.Question editAnswer(@PathVariable int index,
                                                  @Valid @RequestBody EditAnswerRequest req) {
        return RfpSessionResponse.Question.from(rfpSessionService.editAnswer(index, req.answer()));
    }

    @PostMapping("/questions/{index}/regenerate")
    public RfpSessionResponse.Question regenerate(@PathVariable int index) {
        RfpSession session = rfpSessionService.require();
        AnsweredQuestion existing = session.getQuestions().stream()
                .filter(q -> q.getIndex() == index)
                .findFirst()
                .orElseThrow(() -> new NoSuchElementException("No question with index " + index));
        AnsweredQuestion regenerated = rfpProcessingService.regenerate(index, existing.getQuestionText());
        return RfpSessionResponse.Question.from(rfpSessionService.replaceQuestion(regenerated));
    }

    @PostMapping("/document")
    public ResponseEntity<byte[]> document() {
        RfpSession session = rfpSessionService.require();
        var doc = responseAssembler.assemble(session.getQuestions(), session.getSummary());
        byte[] bytes = documentWriter.write(doc);
        String fileName = "RFP_Response_" + LocalDateTime.now(clock).format(FILE_STAMP) + documentWriter.fileExtension();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment().filename(fileName).build().toString())
                .contentType(MediaType.parseMediaType(documentWriter.contentType()))
                .body(bytes);
    }

    @DeleteMapping
    public ResponseEntity<Void> clear() {
        rfpSessionService.clear();
        return ResponseEntity.noContent().build();
    }
}
