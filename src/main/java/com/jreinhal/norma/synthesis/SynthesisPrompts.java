package com.jreinhal.norma.synthesis;

import com.jreinhal.norma.model.ConversationTurn;
import com.jreinhal.norma.rag.fusion.RankedDocument;
import com.jreinhal.norma.reasoning.ReasoningTrace;
import com.jreinhal.norma.util.EvidenceFormatter;
import java.util.List;

/**
 * Prompts for the single synthesis call, in JSON form for the blocking pipeline and in tag
 * form for streaming.
 */
public final class SynthesisPrompts {
    static final int MAX_CONTEXT_DOCUMENTS = 8;
    static final int MAX_CONTEXT_CHARS = 1200;
    static final int MAX_HISTORY_TURNS = 3;

    private static final String BASE_SYSTEM = """
            Sei un assistente per professionisti italiani (commercialisti, consulenti del lavoro, avvocati).
            Rispondi in italiano in modo preciso e operativo, basandoti SOLO sulle fonti fornite e citandole
            con il loro numero tra parentesi quadre, ad esempio [1].
            Se le fonti sono in contrasto, privilegia la fonte di rango superiore e poi la più recente.

            Proponi da 2 a 4 azioni di approfondimento:
            - label tra 8 e 40 caratteri, verbo all'imperativo, specifica (mai "Approfondisci" o "Dettagli");
            - prompt di almeno 25 caratteri, formulato come domanda completa che l'utente invierebbe;
            - ogni azione deve richiamare un valore, una scadenza o una fonte presenti nella risposta;
            - non suggerire MAI di rivolgersi a un commercialista, consulente, avvocato o esperto, né di consultare
              siti ufficiali: l'utente è il professionista;
            - icon tra: calculator, calendar, document, search, scale, chart, list, alert.
            """;

    public static final String JSON_SYSTEM = BASE_SYSTEM + """

            Rispondi SOLO con JSON valido:
            {"answer": "...", "reasoning": "sintesi del ragionamento", "sources_cited": [{"reference": "[1]", "relevance": 0.0-1.0}],
             "suggested_actions": [{"id": "a1", "label": "...", "icon": "calculator", "prompt": "...", "source_basis": "[1]"}]}
            """;

    public static final String TAG_SYSTEM = BASE_SYSTEM + """

            Formato di risposta:
            <answer>testo della risposta con citazioni [n]</answer>
            <suggested_actions>[{"id": "a1", "label": "...", "icon": "calculator", "prompt": "...", "source_basis": "[1]"}]</suggested_actions>
            Se servono dati mancanti per rispondere, aggiungi
            <structured_question>{"question": "...", "options": ["..."]}</structured_question>
            """;

    private SynthesisPrompts() {
    }

    public static String userPrompt(String query, List<RankedDocument> documents, ReasoningTrace trace,
                                    List<ConversationTurn> history, String attachedDocument) {
        StringBuilder sb = new StringBuilder();
        String conversation = ConversationTurn.format(ConversationTurn.lastTurns(history, MAX_HISTORY_TURNS));
        if (!conversation.isEmpty()) {
            sb.append("Conversazione precedente:\n").append(conversation).append("\n\n");
        }
        if (attachedDocument != null && !attachedDocument.isBlank()) {
            sb.append("Documento allegato dall'utente:\n")
                    .append(EvidenceFormatter.truncate(attachedDocument, MAX_CONTEXT_CHARS)).append("\n\n");
        }
        sb.append("Fonti:\n").append(EvidenceFormatter.format(documents, MAX_CONTEXT_DOCUMENTS, MAX_CONTEXT_CHARS)).append("\n\n");
        if (trace != null && !trace.conclusion().isBlank()) {
            sb.append("Ragionamento preliminare: ").append(trace.conclusion());
            if (!trace.sources().isEmpty()) {
                sb.append(" (fonti: ").append(String.join(", ", trace.sources())).append(')');
            }
            sb.append("\n\n");
        }
        sb.append("Domanda: ").append(query);
        return sb.toString();
    }
}
