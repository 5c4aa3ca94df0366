package com.openforge.fleetcore.classifier;

import com.openforge.fleetcore.memory.ConversationMemory;
import com.openforge.fleetcore.memory.ConversationMessage;
import com.openforge.fleetcore.memory.MaritimeEntityExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Scores how much technical depth a query asks for, on a 0..10 scale.
 *
 *   2 points per distinct maintenance / machinery term, at most 6
 *   4 points for an explicit depth request ("in detail", "deep dive"), at most 4
 *
 * Depth is required with two or more terms, any depth phrase, or a short
 * acknowledgement asking for more right after a turn about a concrete entity.
 */
@Component
@RequiredArgsConstructor
public class TechnicalDepthScorer {

    static final int KEYWORD_POINTS    = 2;
    static final int KEYWORD_MAX       = 6;
    static final int PHRASE_POINTS     = 4;
    static final int PHRASE_MAX        = 4;
    static final int SCORE_CAP         = 10;
    static final int PRIOR_TURNS_CHECKED = 2;

    private final MaritimeEntityExtractor entityExtractor;

    public TechnicalDepth score(String query, ConversationMemory memory) {
        if (query == null || query.isBlank()) return TechnicalDepth.NONE;

        int keywords = ClassificationVocabulary.countMatches(ClassificationVocabulary.TECHNICAL_TERMS, query);
        int phrases  = ClassificationVocabulary.countMatches(ClassificationVocabulary.DEPTH_PHRASES, query);

        int score = Math.min(keywords * KEYWORD_POINTS, KEYWORD_MAX)
                  + Math.min(phrases * PHRASE_POINTS, PHRASE_MAX);
        score = Math.min(score, SCORE_CAP);

        boolean required = keywords >= 2
                || phrases > 0
                || (ClassificationVocabulary.ACKNOWLEDGE_AND_EXPAND.matcher(query.trim()).find()
                    && followsEntityTurn(memory));

        return new TechnicalDepth(score, keywords, phrases, required);
    }

    private boolean followsEntityTurn(ConversationMemory memory) {
        if (memory == null) return false;
        return memory.lastMessages(PRIOR_TURNS_CHECKED).stream()
                .map(ConversationMessage::content)
                .anyMatch(text -> text != null
                        && (ClassificationVocabulary.hasEntityKeyword(text) || entityExtractor.mentionsEntity(text)));
    }
}
