package ch.so.arp.rag.router.web;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import ch.so.arp.rag.router.evaluation.BatchEvaluation;
import ch.so.arp.rag.router.evaluation.EvaluationRequest;
import ch.so.arp.rag.router.evaluation.EvaluationResult;
import ch.so.arp.rag.router.evaluation.ResponseEvaluator;
import ch.so.arp.rag.router.pipeline.QueryOrchestrator;
import ch.so.arp.rag.router.pipeline.QueryResult;
import ch.so.arp.rag.router.pipeline.RouterInfo;
import jakarta.validation.Valid;

/**
 * REST endpoints for running queries through the pipeline and for scoring
 * arbitrary responses.
 */
@RestController
@RequestMapping(path = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class QueryController {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryController.class);

    private final QueryOrchestrator orchestrator;
    private final ResponseEvaluator evaluator;

    public QueryController(QueryOrchestrator orchestrator, ResponseEvaluator evaluator) {
        this.orchestrator = orchestrator;
        this.evaluator = evaluator;
    }

    @PostMapping(path = "/query", consumes = MediaType.APPLICATION_JSON_VALUE)
    public QueryResult query(@Valid @RequestBody QueryRequest request) {
        QueryResult result = orchestrator.process(request.query());
        if (!result.isSuccess()) {
            LOGGER.warn("[{}] Query failed with {}", result.requestId(), result.errorCode());
        }
        return result;
    }

    @PostMapping(path = "/evaluations", consumes = MediaType.APPLICATION_JSON_VALUE)
    public EvaluationResult evaluate(@Valid @RequestBody EvaluationRequest request) {
        return evaluator.evaluate(request.query(), request.response());
    }

    @PostMapping(path = "/evaluations/batch", consumes = MediaType.APPLICATION_JSON_VALUE)
    public BatchEvaluation evaluateBatch(@RequestBody List<@Valid EvaluationRequest> requests) {
        return evaluator.evaluateBatch(requests);
    }

    @GetMapping("/info")
    public RouterInfo info() {
        return orchestrator.info();
    }
}
