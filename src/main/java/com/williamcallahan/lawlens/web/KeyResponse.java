package com.williamcallahan.lawlens.web;

import com.williamcallahan.lawlens.domain.navigation.NavigationState;

/**
 * Outcome of a forwarded key press.
 *
 * @param consumed whether the key triggered an action
 * @param state session state after the key press
 */
public record KeyResponse(boolean consumed, NavigationState state) {}
