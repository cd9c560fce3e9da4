package com.example.gateway_bff.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthLoginResponse(@JsonProperty("auth_url") String authUrl) {}
