package com.example.draft.model;

/** 12 人のドラフト参加者の 1 人。index は [0, teamCount) で固定。 */
public record Participant(String id, String name, int index, boolean bot) {}
