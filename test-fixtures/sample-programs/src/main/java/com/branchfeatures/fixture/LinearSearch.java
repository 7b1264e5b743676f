package com.branchfeatures.fixture;

public class LinearSearch {

    public static boolean linearSearch(int[] arr, int n, int x) {
        for (int i = 0; i < n; i++) {
            if (arr[i] == x) return true;
        }
        return false;
    }

    public static void main(String[] args) {
        int[] arr = {1, 3, 5, 7, 9};
        System.out.println(linearSearch(arr, arr.length, 7) ? "Found" : "Not Found");
    }
}
