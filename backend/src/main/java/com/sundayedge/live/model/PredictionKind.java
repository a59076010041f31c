package com.sundayedge.live.model;

public enum PredictionKind {
  MONEYLINE,
  SPREAD,
  OVER_UNDER,
  PLAYER_PROP
}
