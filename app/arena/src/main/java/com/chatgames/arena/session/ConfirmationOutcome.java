package com.chatgames.arena.session;

import com.chatgames.arena.model.Decision;

/** sessionEnded は承認によってこの呼び出しがセッションを終了させた場合だけ true。 */
public record ConfirmationOutcome(
    PendingConfirmation confirmation, Decision decision, boolean sessionEnded) {}
