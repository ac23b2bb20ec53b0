package com.phillippitts.speaktomany.testutil;

import com.phillippitts.speaktomany.domain.Language;
import com.phillippitts.speaktomany.domain.TranslationPreferences;
import com.phillippitts.speaktomany.exception.TranslationException;
import com.phillippitts.speaktomany.service.translation.TranslationService;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fake translator: returns {@code "[<target>] <text>"}. Individual target languages can be
 * made to fail or to stall.
 */
public class FakeTranslationService implements TranslationService {

    public record Call(String text, Language source, Language target, TranslationPreferences preferences) {
    }

    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private final Set<Language> failing = ConcurrentHashMap.newKeySet();
    private final Map<Language, Long> delays = new EnumMap<>(Language.class);

    public FakeTranslationService failFor(Language target) {
        failing.add(target);
        return this;
    }

    public synchronized FakeTranslationService delayFor(Language target, long delayMs) {
        delays.put(target, delayMs);
        return this;
    }

    @Override
    public String translate(String text, Language source, Language target, TranslationPreferences preferences) {
        calls.add(new Call(text, source, target, preferences));
        long delay;
        synchronized (this) {
            delay = delays.getOrDefault(target, 0L);
        }
        if (delay > 0) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (failing.contains(target)) {
            throw new TranslationException("fake failure for " + target, providerName());
        }
        return "[" + target.code() + "] " + text;
    }

    @Override
    public String providerName() {
        return "fake";
    }

    public List<Call> calls() {
        return List.copyOf(calls);
    }
}
