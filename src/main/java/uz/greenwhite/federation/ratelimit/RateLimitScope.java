package uz.greenwhite.federation.ratelimit;

public enum RateLimitScope {
    GLOBAL,
    CLIENT
}
