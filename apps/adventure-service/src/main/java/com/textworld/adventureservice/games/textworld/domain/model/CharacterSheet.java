package com.textworld.adventureservice.games.textworld.domain.model;

/**
 * 玩家角色卡：角色名 + 角色设定
 */
public record CharacterSheet(String name, String setting) {
}
