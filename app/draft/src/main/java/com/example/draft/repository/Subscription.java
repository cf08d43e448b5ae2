package com.example.draft.repository;

/** subscribe 系メソッドの戻り値。unsubscribe は冪等。 */
@FunctionalInterface
public interface Subscription {

  void unsubscribe();
}
