package com.example.draft.engine;

import com.example.draft.model.DraftPlayer;
import com.example.draft.model.PickSource;

public record AutodraftSelection(DraftPlayer player, PickSource source) {}
