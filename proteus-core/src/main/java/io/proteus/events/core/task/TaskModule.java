package io.proteus.events.core.task;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;

public class TaskModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(TaskMaterializer.class).in(Scopes.SINGLETON);
        binder.bind(TaskLifecycle.class).in(Scopes.SINGLETON);
    }
}
