package io.github.chirino.tracker.store.impl;

import io.github.chirino.tracker.model.ActionExecutedEvent;
import io.github.chirino.tracker.model.BotUtteredEvent;
import io.github.chirino.tracker.model.FlattenedTurn;
import io.github.chirino.tracker.model.FlattenedTurn.BotResponse;
import io.github.chirino.tracker.model.TrackerEvent;
import io.github.chirino.tracker.model.UserUtteredEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Summarizes a write batch into one {@link FlattenedTurn}. The user fields come from the first
 * user event of the batch; every action name and bot response of the batch is collected in order.
 */
public class FlattenedTurnMaterializer {

    public Optional<FlattenedTurn> materialize(
            String senderId, String turnId, List<TrackerEvent> batch) {
        UserUtteredEvent firstUser = null;
        List<String> actionNames = new ArrayList<>();
        List<BotResponse> botResponses = new ArrayList<>();
        for (TrackerEvent event : batch) {
            if (event instanceof UserUtteredEvent user) {
                if (firstUser == null) {
                    firstUser = user;
                }
            } else if (event instanceof ActionExecutedEvent action) {
                actionNames.add(action.name());
            } else if (event instanceof BotUtteredEvent bot) {
                botResponses.add(new BotResponse(bot.text(), bot.data()));
            }
        }
        if (firstUser == null) {
            return Optional.empty();
        }
        return Optional.of(
                new FlattenedTurn(
                        senderId,
                        turnId,
                        firstUser.timestamp(),
                        firstUser.text(),
                        firstUser.intentName(),
                        firstUser.intentConfidence(),
                        actionNames,
                        botResponses));
    }
}
