package com.example.hipagent.controller;

import com.example.hipagent.model.AnswerRequest;
import com.example.hipagent.model.AnswerResponse;
import com.example.hipagent.service.MultipleChoiceAgent;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/agent")
@RequiredArgsConstructor
public class AgentController {

    private final MultipleChoiceAgent agent;

    /**
     * Answers one question. Invalid input is reported through {@code status}, not an HTTP error:
     *   POST /api/agent/answer
     *   {
     *     "question": "Which organelle produces ATP?",
     *     "choices": ["Nucleus", "Mitochondrion", "Ribosome", "Golgi apparatus"]
     *   }
     */
    @PostMapping("/answer")
    public AnswerResponse answer(@RequestBody AnswerRequest request) {
        return AnswerResponse.from(agent.answer(request.question(), request.resolveChoices()));
    }
}
