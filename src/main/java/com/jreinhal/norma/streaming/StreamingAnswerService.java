package com.jreinhal.norma.streaming;

import com.jreinhal.norma.dto.QueryAnswerResponse;
import com.jreinhal.norma.foundation.ModelOrchestrator;
import com.jreinhal.norma.model.PipelineRequest;
import com.jreinhal.norma.pipeline.PreparedQuery;
import com.jreinhal.norma.pipeline.QueryPipelineService;
import com.jreinhal.norma.synthesis.SynthesisPayload;
import com.jreinhal.norma.synthesis.SynthesisPrompts;
import com.jreinhal.norma.synthesis.SynthesisResponseParser;
import com.jreinhal.norma.synthesis.SynthesisResult;
import com.jreinhal.norma.synthesis.SynthesisService;
import com.jreinhal.norma.util.LogSanitizer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Streaming variant of the pipeline. Stages up to reasoning run as in the blocking path;
 * synthesis is streamed in tag format through a {@link StreamingTagFilter}, and the
 * validated actions follow once content is complete.
 */
@Service
public class StreamingAnswerService {
    private static final Logger log = LoggerFactory.getLogger(StreamingAnswerService.class);
    static final String ERROR_MESSAGE = "Non è stato possibile completare la risposta. Riprova tra qualche istante.";

    private final QueryPipelineService queryPipelineService;
    private final ModelOrchestrator modelOrchestrator;
    private final SynthesisResponseParser responseParser;
    private final SynthesisService synthesisService;

    public StreamingAnswerService(QueryPipelineService queryPipelineService, ModelOrchestrator modelOrchestrator,
                                  SynthesisResponseParser responseParser, SynthesisService synthesisService) {
        this.queryPipelineService = queryPipelineService;
        this.modelOrchestrator = modelOrchestrator;
        this.responseParser = responseParser;
        this.synthesisService = synthesisService;
    }

    public Flux<StreamEvent> stream(PipelineRequest request) {
        return Mono.fromCallable(() -> QueryPipelineService.withRequestContext(request,
                        () -> this.queryPipelineService.prepare(request)))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(prepared -> prepared.isCasualChat() ? this.casual(prepared) : this.synthesize(prepared))
                .onErrorResume(error -> {
                    log.warn("Streaming: request {} failed: {}", request.requestId(), error.getMessage());
                    return Flux.just(StreamEvent.error(ERROR_MESSAGE), StreamEvent.done());
                });
    }

    private Flux<StreamEvent> casual(PreparedQuery prepared) {
        return Mono.fromCallable(() -> QueryPipelineService.withRequestContext(prepared.request(),
                        () -> this.queryPipelineService.casualReply(prepared)))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(response -> Flux.just(StreamEvent.content(response.answer()),
                        StreamEvent.actions(List.of()), StreamEvent.done()));
    }

    private Flux<StreamEvent> synthesize(PreparedQuery prepared) {
        return Flux.defer(() -> {
            StreamingTagFilter filter = new StreamingTagFilter();
            StringBuilder raw = new StringBuilder();
            AtomicBoolean interrupted = new AtomicBoolean(false);
            String prompt = SynthesisPrompts.userPrompt(prepared.request().query(), prepared.documents(),
                    prepared.reasoning(), prepared.request().history(), prepared.request().attachedDocument());
            Flux<StreamEvent> content = this.modelOrchestrator
                    .stream(prepared.plan().tier(), SynthesisPrompts.TAG_SYSTEM, prompt,
                            prepared.plan().callOptions().withTimeoutMs(Math.max(1L, prepared.deadline().remainingMs())))
                    .map(chunk -> {
                        raw.append(chunk);
                        return filter.accept(chunk);
                    })
                    .filter(text -> !text.isEmpty())
                    .map(StreamEvent::content)
                    .onErrorResume(error -> {
                        if (raw.length() == 0) {
                            return Flux.error(error);
                        }
                        interrupted.set(true);
                        log.warn("Streaming: synthesis for request {} interrupted after {} chars, closing with partial answer: {}",
                                prepared.request().requestId(), raw.length(), error.getMessage());
                        return Flux.empty();
                    });
            Flux<StreamEvent> tail = Mono.fromCallable(() -> QueryPipelineService.withRequestContext(prepared.request(),
                            () -> this.finalEvents(prepared, filter, raw.toString(), interrupted.get())))
                    .subscribeOn(Schedulers.boundedElastic())
                    .flatMapMany(Flux::fromIterable);
            return Flux.concat(content, tail);
        });
    }

    List<StreamEvent> finalEvents(PreparedQuery prepared, StreamingTagFilter filter, String raw) {
        return this.finalEvents(prepared, filter, raw, false);
    }

    List<StreamEvent> finalEvents(PreparedQuery prepared, StreamingTagFilter filter, String raw, boolean interrupted) {
        List<StreamEvent> events = new ArrayList<>();
        String rest = filter.finish();
        if (!rest.isEmpty()) {
            events.add(StreamEvent.content(rest));
        }
        SynthesisPayload payload = this.responseParser.parse(raw, prepared.documents());
        SynthesisResult synthesis = interrupted
                ? this.synthesisService.interrupted(payload, prepared.reasoning(), prepared.documents())
                : this.synthesisService.assemble(payload, prepared.reasoning(), prepared.documents(), false);
        QueryAnswerResponse response = this.queryPipelineService.finish(prepared, synthesis);
        if (interrupted && response.disclaimer() != null) {
            events.add(StreamEvent.content("\n\n" + response.disclaimer()));
        }
        events.add(StreamEvent.actions(response.suggestedActions()));
        if (response.structuredQuestion() != null) {
            events.add(StreamEvent.question(response.structuredQuestion()));
        }
        events.add(StreamEvent.done());
        log.info("Streaming: {} completed with {} actions", LogSanitizer.querySummary(prepared.request().query()),
                response.suggestedActions().size());
        return events;
    }
}
