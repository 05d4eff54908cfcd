package com.stakeduel.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

public class DailyCounterId implements Serializable {

    private String accountId;
    private LocalDate counterDay;

    public DailyCounterId() {
    }

    public DailyCounterId(String accountId, LocalDate counterDay) {
        this.accountId = accountId;
        this.counterDay = counterDay;
    }

    public String getAccountId() {
        return accountId;
    }

    public LocalDate getCounterDay() {
        return counterDay;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DailyCounterId that)) {
            return false;
        }
        return Objects.equals(accountId, that.accountId) && Objects.equals(counterDay, that.counterDay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accountId, counterDay);
    }
}
