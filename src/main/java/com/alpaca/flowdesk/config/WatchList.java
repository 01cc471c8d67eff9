package com.alpaca.flowdesk.config;

import java.util.List;

public record WatchList(List<String> symbols) {}
