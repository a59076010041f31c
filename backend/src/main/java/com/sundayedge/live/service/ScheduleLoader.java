package com.sundayedge.live.service;

import com.sundayedge.live.model.ScheduledGame;
import java.util.List;

public interface ScheduleLoader {
  List<ScheduledGame> load(String windowId);
}
