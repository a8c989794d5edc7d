package com.poolmate.backend.modules.notification.domain;

public enum NotificationKind {
    DRAW_OPT_IN_REQUEST("추첨 참여 확인 요청", 24),
    DRAW_WINNER("추첨 당첨 안내", 24 * 7),
    DRAW_RESULT("추첨 결과 안내", 24 * 7),
    DRAW_CANCELLED("추첨 취소 안내", 24 * 7);

    private final String title;
    private final int ttlHours;

    NotificationKind(String title, int ttlHours) {
        this.title = title;
        this.ttlHours = ttlHours;
    }

    public String getTitle() {
        return title;
    }

    public int getTtlHours() {
        return ttlHours;
    }
}
