package io.github.suppierk.views.test;

import io.github.suppierk.views.test.TestEvents.Broken;
import io.github.suppierk.views.test.TestEvents.CounterCreated;
import io.github.suppierk.views.test.TestEvents.Decremented;
import io.github.suppierk.views.test.TestEvents.Exploded;
import io.github.suppierk.views.test.TestEvents.Incremented;
import io.github.suppierk.views.test.TestEvents.Renamed;
import io.github.suppierk.views.value.ViewValueType;
import io.github.suppierk.views.view.CounterView;
import io.github.suppierk.views.view.EntityViewGroup;
import io.github.suppierk.views.view.EntityViewGroupProjectors;
import io.github.suppierk.views.view.ValueView;
import io.github.suppierk.views.view.ViewGroup;

/** A sample {@link EntityViewGroup} with a counter and a title. */
public final class CounterViewGroup implements EntityViewGroup {
  public static final String COUNTER = "counter";
  public static final String TITLE = "title";

  private final CounterView counter;
  private final ValueView<String> title;

  public CounterViewGroup(CounterCreated event) {
    this.counter = new CounterView(COUNTER, event.seed());
    this.title = new ValueView<>(TITLE, ViewValueType.STRING, "untitled");
  }

  @Override
  public void initViews(ViewGroup views) {
    views.add(counter);
    views.add(title);
  }

  @Override
  public void initProjectors(EntityViewGroupProjectors projectors) {
    projectors.add(Incremented.class, event -> counter.increment(event.by()));
    projectors.add(Decremented.class, event -> counter.decrement(event.by()));
    projectors.add(Renamed.class, event -> title.setValue(event.title()));
    projectors.add(
        Exploded.class,
        event -> {
          counter.increment(100);
          throw new IllegalStateException("Projector failure");
        });
    projectors.add(
        Broken.class,
        event -> {
          counter.increment(100);
          throw new AssertionError("Counter overflow");
        });
  }

  public CounterView counter() {
    return counter;
  }
}
