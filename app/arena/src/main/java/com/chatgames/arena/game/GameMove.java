package com.chatgames.arena.game;

/** プレイヤー操作の入力。ゲーム種別ごとの record が実装する。 */
public interface GameMove {}
