package com.p14n.pollevent.group;

@FunctionalInterface
public interface GroupListener {

    void groupDestroyed(String id);
}
