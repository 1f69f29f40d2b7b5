package com.example.federation.controller;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Callable;

final class Blocking {

    private Blocking() {}

    /**
     * Runs store-bound work off the event loop.
     */
    static <T> Mono<T> call(Callable<T> work) {
        return Mono.fromCallable(work).subscribeOn(Schedulers.boundedElastic());
    }
}
