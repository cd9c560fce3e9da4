package com.example.gateway_bff.service.dto;

import com.example.gateway_bff.model.SessionUser;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthVerifyResponse(boolean valid, SessionUser user) {}
