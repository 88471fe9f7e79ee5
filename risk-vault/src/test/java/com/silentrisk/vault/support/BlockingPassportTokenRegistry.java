package com.silentrisk.vault.support;

import com.silentrisk.vault.model.passport.Passport;
import com.silentrisk.vault.repository.passport.InMemoryPassportTokenRegistry;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Token registry whose first save holds the running transaction open until released, then fails it.
 */
public class BlockingPassportTokenRegistry extends InMemoryPassportTokenRegistry {

    private final CountDownLatch entered = new CountDownLatch(1);
    private final CountDownLatch released = new CountDownLatch(1);

    @Override
    public void save(Passport passport) {
        if (entered.getCount() == 0) {
            super.save(passport);
            return;
        }
        entered.countDown();
        try {
            if (!released.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Passport save was never released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while saving passport", e);
        }
        throw new IllegalStateException("Passport storage unavailable");
    }

    public boolean awaitSave() throws InterruptedException {
        return entered.await(5, TimeUnit.SECONDS);
    }

    public void release() {
        released.countDown();
    }

}
