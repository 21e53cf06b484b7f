package com.clusterscope.backend.navigation;

public enum NavigationState {
    IDLE,
    BROWSING
}
