package io.quarkus.qe.git.content.search.search;

@FunctionalInterface
public interface ProbeListener {

    void onProbe(ProbeEvent event);

}
