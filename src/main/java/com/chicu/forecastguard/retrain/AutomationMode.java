package com.chicu.forecastguard.retrain;

public enum AutomationMode {
    /** ретрейн без участия человека */
    AUTO,
    /** legacy-вариант с подтверждением: консоль не ждём, работает как ручной режим */
    MANUAL_CONFIRM
}
