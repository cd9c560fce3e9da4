package com.example.auth.api.response;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StateDebugResponse(@JsonProperty("stored_states_count") int storedStatesCount) {}
