package com.deck.mirror.remote;

import com.deck.mirror.core.model.Card;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversions between remote card resources and local cards.
 */
public final class RemoteCards {

    private static final String DELIMITER = "---";

    private RemoteCards() {
    }

    /**
     * Splits remote content at the first delimiter. Content without a delimiter is all question.
     */
    public static String[] splitContent(String content) {
        if (content == null) {
            return new String[]{"", ""};
        }
        int at = content.indexOf(DELIMITER);
        if (at < 0) {
            return new String[]{content.strip(), ""};
        }
        return new String[]{
                content.substring(0, at).strip(),
                content.substring(at + DELIMITER.length()).strip()
        };
    }

    public static Card toCard(RemoteCard remote) {
        String[] parts = splitContent(remote.content());
        return Card.of(remote.id(), parts[0], parts[1], remote.tags(), remote.isArchived());
    }

    public static List<Card> toCards(List<RemoteCard> remotes) {
        List<Card> cards = new ArrayList<>(remotes.size());
        for (RemoteCard remote : remotes) {
            cards.add(toCard(remote));
        }
        return cards;
    }
}
