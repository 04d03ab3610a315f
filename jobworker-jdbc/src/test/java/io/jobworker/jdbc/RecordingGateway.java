package io.jobworker.jdbc;

import io.jobworker.notify.MessageGateway;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory gateway that records sends and deletes and can be told to fail for some targets.
 */
final class RecordingGateway implements MessageGateway {
    final List<String> sent = Collections.synchronizedList(new ArrayList<>());
    final List<String> deleted = Collections.synchronizedList(new ArrayList<>());
    final Set<String> failSendTo = Collections.synchronizedSet(new HashSet<>());
    final Set<String> failDeleteIn = Collections.synchronizedSet(new HashSet<>());
    private final AtomicInteger ids = new AtomicInteger();

    @Override
    public String send(String targetId, String text) throws Exception {
        if (failSendTo.contains(targetId)) {
            throw new IllegalStateException("bot was blocked by " + targetId);
        }
        sent.add(targetId + ":" + text);
        return "m" + ids.incrementAndGet();
    }

    @Override
    public void delete(String targetId, String messageId) throws Exception {
        if (failDeleteIn.contains(targetId)) {
            throw new IllegalStateException("message can't be deleted");
        }
        deleted.add(targetId + ":" + messageId);
    }
}
