package com.example.hipagent.controller;

import com.example.hipagent.model.RetrievalQuery;
import com.example.hipagent.model.RetrievalResult;
import com.example.hipagent.service.RagRetrievalService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/rag")
@RequiredArgsConstructor
public class RagRetrievalController {

    private final RagRetrievalService ragRetrievalService;

    /**
     * Simple mode, configured topK and char budget:
     *   GET /api/rag/retrieve?q=xxx
     */
    @GetMapping("/retrieve")
    public RetrievalResult retrieveByQueryParam(
            @RequestParam("q") String question
    ) {
        return ragRetrievalService.retrieve(new RetrievalQuery(question, null, null));
    }

    /**
     * Advanced mode, caller controls topK and maxChars:
     *   POST /api/rag/retrieve
     *   {
     *     "question": "xxx",
     *     "topK": 8,
     *     "maxChars": 4000
     *   }
     */
    @PostMapping("/retrieve")
    public RetrievalResult retrieveByBody(
            @RequestBody RetrievalQuery request
    ) {
        return ragRetrievalService.retrieve(request);
    }
}
