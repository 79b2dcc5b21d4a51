package com.hrintake.telegram.model;

public record BotCommand(String command, String description) {}
