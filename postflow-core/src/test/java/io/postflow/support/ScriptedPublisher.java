package io.postflow.support;

import io.postflow.Platform;
import io.postflow.model.AccessToken;
import io.postflow.model.PublishContent;
import io.postflow.platform.PlatformPublisher;
import io.postflow.platform.PublishOutcome;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Publisher returning queued outcomes in order, then a fallback for every further call.
 */
public final class ScriptedPublisher implements PlatformPublisher {
  private final Platform platform;
  private final Deque<Supplier<PublishOutcome>> script = new ArrayDeque<>();
  private Supplier<PublishOutcome> fallback;
  private final List<AccessToken> tokens = new CopyOnWriteArrayList<>();
  private final List<PublishContent> contents = new CopyOnWriteArrayList<>();

  public ScriptedPublisher(Platform platform) {
    this.platform = platform;
    this.fallback = () -> PublishOutcome.success(platform.tag() + "-post-" + contents.size());
  }

  public synchronized ScriptedPublisher then(PublishOutcome outcome) {
    script.add(() -> outcome);
    return this;
  }

  public synchronized ScriptedPublisher then(Supplier<PublishOutcome> outcome) {
    script.add(outcome);
    return this;
  }

  public synchronized ScriptedPublisher otherwise(PublishOutcome outcome) {
    this.fallback = () -> outcome;
    return this;
  }

  @Override
  public Platform platform() {
    return platform;
  }

  @Override
  public PublishOutcome publish(PublishContent content, AccessToken token) {
    Supplier<PublishOutcome> next;
    synchronized (this) {
      tokens.add(token);
      contents.add(content);
      next = script.isEmpty() ? fallback : script.poll();
    }
    return next.get();
  }

  public int calls() {
    return tokens.size();
  }

  public List<AccessToken> tokens() {
    return tokens;
  }

  public List<PublishContent> contents() {
    return contents;
  }
}
